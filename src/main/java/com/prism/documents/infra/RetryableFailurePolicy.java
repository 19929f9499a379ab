package com.prism.documents.infra;

import com.prism.documents.exception.DimensionMismatchException;
import com.prism.documents.exception.EmbeddingProviderException;
import dev.langchain4j.exception.RetriableException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

import java.util.List;
import java.util.Locale;

/**
 * Retries only transient provider failures: explicit rate limiting, a model
 * that is still loading, and gateway 503/504 responses.
 */
public class RetryableFailurePolicy extends SimpleRetryPolicy {

    private static final List<String> TRANSIENT_MARKERS = List.of("rate limit", "loading", "503", "504");

    public RetryableFailurePolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        return last == null || (isRetryable(last) && context.getRetryCount() < getMaxAttempts());
    }

    public static boolean isRetryable(Throwable error) {
        if (error instanceof DimensionMismatchException) {
            return false;
        }
        if (error instanceof EmbeddingProviderException providerError) {
            return providerError.isRetryable();
        }
        if (error instanceof RetriableException) {
            return true;
        }
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return TRANSIENT_MARKERS.stream().anyMatch(lower::contains);
    }
}
