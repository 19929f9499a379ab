package com.prism.documents.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chunking")
public record ChunkingProperties(
    @Min(1) int size,
    @Min(0) int overlap,
    @Min(0) int minLength
) {

    @AssertTrue(message = "overlap must be smaller than size")
    public boolean isOverlapSmallerThanSize() {
        return overlap < size;
    }
}
