package com.prism.documents.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.worker")
public record WorkerProperties(
    @Min(1) int staleThresholdMinutes,
    @Min(1000) long checkIntervalMs
) {}
