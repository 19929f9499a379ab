package com.prism.documents.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Page rasterization settings. A scale of 1.0 renders at 72 dpi.
 */
@Validated
@ConfigurationProperties(prefix = "app.render")
public record RenderProperties(
    @Min(1) int maxPages,
    @DecimalMin("0.1") float scale,
    @Min(1) @Max(100) int quality,
    @NotNull Duration timeout
) {}
