package com.prism.documents.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
    @Min(1) int corePoolSize,
    @Min(1) int maxPoolSize,
    @Min(0) int queueCapacity,
    @Min(1) int renderPoolSize,
    @Min(0) int renderQueueCapacity
) {}
