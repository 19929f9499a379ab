package com.prism.documents.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

import java.time.Duration;

/**
 * Waits {@code attempt * baseDelay} before the next attempt.
 */
@Slf4j
@RequiredArgsConstructor
public class LinearBackOffPolicy implements BackOffPolicy {

    private final Duration baseDelay;
    private final Sleeper sleeper;

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        RetryContext retryContext = ((AttemptContext) backOffContext).retryContext();
        int attempt = retryContext.getRetryCount();
        long delay = baseDelay.toMillis() * attempt;

        Throwable last = retryContext.getLastThrowable();
        log.warn("Embedding attempt {} failed ({}), retrying in {} ms",
            attempt, last == null ? "unknown" : last.getMessage(), delay);

        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while backing off", e);
        }
    }

    private record AttemptContext(RetryContext retryContext) implements BackOffContext {}
}
