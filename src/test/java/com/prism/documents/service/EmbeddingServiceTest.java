package com.prism.documents.service;

import com.prism.documents.config.EmbeddingProperties;
import com.prism.documents.exception.DimensionMismatchException;
import com.prism.documents.exception.EmbeddingProviderException;
import com.prism.documents.infra.LinearBackOffPolicy;
import com.prism.documents.infra.RateLimiter;
import com.prism.documents.infra.RetryableFailurePolicy;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    private static final int DIMENSION = 4;

    @Mock
    private EmbeddingModel embeddingModel;

    private final List<Long> sleeps = new ArrayList<>();
    private final List<Integer> limiterPermits = new ArrayList<>();
    private EmbeddingServiceImpl embeddingService;

    @BeforeEach
    void setUp() {
        embeddingService = service("hf_test_token");
    }

    private EmbeddingServiceImpl service(String apiKey) {
        EmbeddingProperties properties = new EmbeddingProperties(
            "https://hf.test/models", apiKey, "sentence-transformers/all-MiniLM-L6-v2",
            DIMENSION, 2, Duration.ofMillis(200), 3, Duration.ofSeconds(1), Duration.ofSeconds(30),
            2000, 300, 1_000_000);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new RetryableFailurePolicy(properties.maxAttempts()));
        retryTemplate.setBackOffPolicy(new LinearBackOffPolicy(properties.retryBaseDelay(), sleeps::add));

        RateLimiter limiter = (key, permits) -> limiterPermits.add(permits);
        return new EmbeddingServiceImpl(embeddingModel, limiter, retryTemplate, sleeps::add, properties);
    }

    private static Embedding vector(float seed) {
        return Embedding.from(new float[]{seed, 0, 0, 1});
    }

    private static Response<List<Embedding>> batchOf(float... seeds) {
        List<Embedding> embeddings = new ArrayList<>();
        for (float seed : seeds) {
            embeddings.add(vector(seed));
        }
        return Response.from(embeddings);
    }

    @Nested
    @DisplayName("Retry policy")
    class RetryPolicy {

        @Test
        @DisplayName("Should retry a transient failure and then succeed")
        void shouldRetryAndEventuallySucceed() {
            when(embeddingModel.embedAll(anyList()))
                .thenThrow(new EmbeddingProviderException("Service unavailable (503)", true))
                .thenReturn(batchOf(1f));

            List<float[]> vectors = embeddingService.embedBatch(List.of("text"));

            assertThat(vectors).hasSize(1);
            verify(embeddingModel, times(2)).embedAll(anyList());
            assertThat(sleeps).containsExactly(1000L);
        }

        @Test
        @DisplayName("Should treat langchain4j retriable exceptions as transient")
        void shouldRetryLangchainRetriableException() {
            when(embeddingModel.embedAll(anyList()))
                .thenThrow(new RetriableException("API Timeout"))
                .thenReturn(batchOf(1f));

            embeddingService.embedBatch(List.of("text"));

            verify(embeddingModel, times(2)).embedAll(anyList());
        }

        @Test
        @DisplayName("Should give up after 3 attempts with linearly growing delays")
        void shouldPropagateAfterExhaustingRetries() {
            when(embeddingModel.embedAll(anyList()))
                .thenThrow(new EmbeddingProviderException("Model is currently loading", true));

            assertThatThrownBy(() -> embeddingService.embedBatch(List.of("text")))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("loading");

            verify(embeddingModel, times(3)).embedAll(anyList());
            assertThat(sleeps).containsExactly(1000L, 2000L);
        }

        @Test
        @DisplayName("Should not retry terminal failures")
        void shouldNotRetryTerminalErrors() {
            when(embeddingModel.embedAll(anyList()))
                .thenThrow(new EmbeddingProviderException("Invalid credentials", false));

            assertThatThrownBy(() -> embeddingService.embedBatch(List.of("text")))
                .isInstanceOf(EmbeddingProviderException.class);

            verify(embeddingModel, times(1)).embedAll(anyList());
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("Should fail hard on a dimension mismatch without retrying")
        void shouldRejectWrongDimension() {
            when(embeddingModel.embedAll(anyList()))
                .thenReturn(Response.from(List.of(Embedding.from(new float[768]))));

            assertThatThrownBy(() -> embeddingService.embedBatch(List.of("text")))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessage("Unexpected embedding dimension: got 768, expected 4");

            verify(embeddingModel, times(1)).embedAll(anyList());
        }
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("Should split into sub-batches, pause between them and keep order")
        void shouldBatchAndPreserveOrder() {
            when(embeddingModel.embedAll(anyList()))
                .thenReturn(batchOf(0f, 1f))
                .thenReturn(batchOf(2f, 3f))
                .thenReturn(batchOf(4f));

            List<String> texts = IntStream.range(0, 5).mapToObj(i -> "chunk " + i).toList();
            List<float[]> vectors = embeddingService.embedBatch(texts);

            assertThat(vectors).extracting(v -> v[0]).containsExactly(0f, 1f, 2f, 3f, 4f);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
            verify(embeddingModel, times(3)).embedAll(captor.capture());
            assertThat(captor.getAllValues()).extracting(List::size).containsExactly(2, 2, 1);
            assertThat(captor.getAllValues().get(2).get(0).text()).isEqualTo("chunk 4");

            assertThat(sleeps).containsExactly(200L, 200L);
            assertThat(limiterPermits).containsExactly(14, 14, 7);
        }

        @Test
        @DisplayName("Should reject a provider answer with missing vectors")
        void shouldRejectShortAnswer() {
            when(embeddingModel.embedAll(anyList())).thenReturn(batchOf(1f));

            assertThatThrownBy(() -> embeddingService.embedBatch(List.of("one", "two")))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("Expected 2 embeddings, got 1");
        }

        @Test
        @DisplayName("Should return nothing for no input without calling the provider")
        void shouldHandleEmptyBatch() {
            assertThat(embeddingService.embedBatch(List.of())).isEmpty();
            verifyNoInteractions(embeddingModel);
        }
    }

    @Nested
    @DisplayName("Input hygiene")
    class InputHygiene {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"  ", "\t\n"})
        @DisplayName("Should reject blank text before calling the provider")
        void shouldRejectBlankText(String text) {
            assertThatThrownBy(() -> embeddingService.embed(text))
                .isInstanceOf(IllegalArgumentException.class);

            verifyNoInteractions(embeddingModel);
        }

        @Test
        @DisplayName("Should trim and truncate long input")
        void shouldTrimAndTruncate() {
            when(embeddingModel.embed(anyString())).thenReturn(Response.from(vector(1f)));

            embeddingService.embed("   " + "x".repeat(3000) + "   ");

            ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
            verify(embeddingModel).embed(captor.capture());
            assertThat(captor.getValue()).hasSize(2000).doesNotStartWith(" ");
        }

        @Test
        @DisplayName("Should refuse to call an unconfigured provider")
        void shouldFailWhenNotConfigured() {
            EmbeddingServiceImpl unconfigured = service("");

            assertThat(unconfigured.isConfigured()).isFalse();
            assertThatThrownBy(() -> unconfigured.embed("query"))
                .isInstanceOf(EmbeddingProviderException.class)
                .hasMessageContaining("not configured");
            verifyNoInteractions(embeddingModel);
        }
    }
}
