package com.prism.documents.infra;

import com.prism.documents.exception.DimensionMismatchException;
import com.prism.documents.exception.EmbeddingProviderException;
import dev.langchain4j.exception.RetriableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.retry.RetryContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetryableFailurePolicyTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "Rate limit reached for model",
        "Model sentence-transformers/all-MiniLM-L6-v2 is currently loading",
        "HTTP 503 Service Unavailable",
        "504 Gateway Timeout"
    })
    @DisplayName("Transient messages are retryable")
    void shouldRetryTransientMessages(String message) {
        assertThat(RetryableFailurePolicy.isRetryable(new IllegalStateException(message))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Invalid credentials", "400 Bad Request", ""})
    @DisplayName("Other messages are terminal")
    void shouldNotRetryOtherMessages(String message) {
        assertThat(RetryableFailurePolicy.isRetryable(new IllegalStateException(message))).isFalse();
    }

    @Test
    @DisplayName("Provider exceptions carry their own retryable flag")
    void shouldHonourProviderFlag() {
        assertThat(RetryableFailurePolicy.isRetryable(new EmbeddingProviderException("503 loading", false))).isFalse();
        assertThat(RetryableFailurePolicy.isRetryable(new EmbeddingProviderException("timeout", true))).isTrue();
        assertThat(RetryableFailurePolicy.isRetryable(new RetriableException("busy"))).isTrue();
    }

    @Test
    @DisplayName("Dimension mismatches are never retried")
    void shouldNeverRetryDimensionMismatch() {
        assertThat(RetryableFailurePolicy.isRetryable(new DimensionMismatchException(384, 768))).isFalse();
    }

    @Test
    @DisplayName("Retry stops at the attempt limit")
    void shouldStopAtMaxAttempts() {
        RetryableFailurePolicy policy = new RetryableFailurePolicy(3);
        RetryContext context = policy.open(null);
        EmbeddingProviderException transientError = new EmbeddingProviderException("503", true);

        assertThat(policy.canRetry(context)).isTrue();
        policy.registerThrowable(context, transientError);
        policy.registerThrowable(context, transientError);
        assertThat(policy.canRetry(context)).isTrue();
        policy.registerThrowable(context, transientError);
        assertThat(policy.canRetry(context)).isFalse();
    }

    @Test
    @DisplayName("Back-off grows linearly with the attempt number")
    void shouldBackOffLinearly() {
        List<Long> sleeps = new ArrayList<>();
        LinearBackOffPolicy backOff = new LinearBackOffPolicy(Duration.ofSeconds(1), sleeps::add);
        RetryableFailurePolicy policy = new RetryableFailurePolicy(3);
        RetryContext context = policy.open(null);

        var backOffContext = backOff.start(context);
        policy.registerThrowable(context, new EmbeddingProviderException("503", true));
        backOff.backOff(backOffContext);
        policy.registerThrowable(context, new EmbeddingProviderException("503", true));
        backOff.backOff(backOffContext);

        assertThat(sleeps).containsExactly(1000L, 2000L);
    }
}
