package com.prism.documents.exception;

import lombok.Getter;

/**
 * Failure reported by (or while talking to) the embedding provider.
 * {@code retryable} marks rate limiting, model warm-up and 503/504-class failures.
 */
@Getter
public class EmbeddingProviderException extends RuntimeException {
    private final boolean retryable;
    private final Integer statusCode;

    public EmbeddingProviderException(String message, boolean retryable) {
        this(message, retryable, null, null);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        this(message, false, null, cause);
    }

    public EmbeddingProviderException(String message, boolean retryable, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.statusCode = statusCode;
    }
}
