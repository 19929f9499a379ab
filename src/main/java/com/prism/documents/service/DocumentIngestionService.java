package com.prism.documents.service;

import com.prism.documents.config.RenderProperties;
import com.prism.documents.exception.ExtractionException;
import com.prism.documents.infra.LocalFileStorage;
import com.prism.documents.model.ExtractionResult;
import com.prism.documents.model.PageImage;
import com.prism.documents.model.ProcessingStatus;
import com.prism.documents.model.TextChunk;
import com.prism.documents.pdf.PageRenderer;
import com.prism.documents.pdf.PdfTextExtractor;
import com.prism.documents.pdf.TextChunker;
import com.prism.documents.repository.DocumentRepository;
import com.prism.documents.repository.PageImageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one document through extraction, rendering, chunking and indexing.
 * <p>
 * Two status axes are tracked. {@code status} fails only when the text cannot
 * be extracted; once it is {@code COMPLETED} the document stays viewable.
 * {@code embeddingStatus} records whether the search index was built, so an
 * indexing failure degrades search without failing the document.
 */
@Slf4j
@Service
public class DocumentIngestionService {

    private final DocumentRepository documentRepository;
    private final PageImageRepository pageImageRepository;
    private final PdfTextExtractor textExtractor;
    private final PageRenderer pageRenderer;
    private final TextChunker chunker;
    private final VectorStoreService vectorStore;
    private final EmbeddingService embeddingService;
    private final LocalFileStorage storage;
    private final Executor renderExecutor;
    private final RenderProperties renderProperties;

    public DocumentIngestionService(
        DocumentRepository documentRepository,
        PageImageRepository pageImageRepository,
        PdfTextExtractor textExtractor,
        PageRenderer pageRenderer,
        TextChunker chunker,
        VectorStoreService vectorStore,
        EmbeddingService embeddingService,
        LocalFileStorage storage,
        @Qualifier("renderTaskExecutor") Executor renderExecutor,
        RenderProperties renderProperties
    ) {
        this.documentRepository = documentRepository;
        this.pageImageRepository = pageImageRepository;
        this.textExtractor = textExtractor;
        this.pageRenderer = pageRenderer;
        this.chunker = chunker;
        this.vectorStore = vectorStore;
        this.embeddingService = embeddingService;
        this.storage = storage;
        this.renderExecutor = renderExecutor;
        this.renderProperties = renderProperties;
    }

    /**
     * Never throws: every outcome is recorded on the document row.
     */
    public void processDocument(UUID documentId, UUID userId, String filePath) {
        Optional<List<TextChunk>> chunks;
        try {
            chunks = processContent(documentId, filePath);
        } catch (RuntimeException e) {
            log.error("Doc {}: processing failed", documentId, e);
            failQuietly(documentId, e.getMessage());
            return;
        }

        chunks.ifPresent(found -> {
            try {
                buildSearchIndex(documentId, userId, found);
            } catch (RuntimeException e) {
                log.error("Doc {}: could not record embedding outcome", documentId, e);
            }
        });
    }

    /**
     * Stages up to {@code status = COMPLETED}. Empty when the pipeline stops
     * before indexing: not claimable, extraction failed, or deleted meanwhile.
     */
    private Optional<List<TextChunk>> processContent(UUID documentId, String filePath) {
        if (!documentRepository.claimForProcessing(documentId)) {
            log.info("Doc {}: not pending, skipping", documentId);
            return Optional.empty();
        }
        log.info("Doc {}: processing started", documentId);

        byte[] pdf;
        ExtractionResult extraction;
        try {
            pdf = storage.readBytes(filePath);
            extraction = textExtractor.extract(pdf);
        } catch (ExtractionException | UncheckedIOException e) {
            log.error("Doc {}: text extraction failed: {}", documentId, e.getMessage());
            failQuietly(documentId, e.getMessage());
            return Optional.empty();
        }

        CompletableFuture<List<PageImage>> rendering = startRendering(documentId, pdf);
        List<TextChunk> chunks = chunker.chunk(extraction.text(), extraction.pageCount());
        List<PageImage> images = awaitRendering(documentId, rendering);

        if (!documentRepository.markCompleted(documentId, extraction, images.size())) {
            log.warn("Doc {}: deleted during processing, discarding results", documentId);
            pageRenderer.deleteDocumentImages(documentId);
            return Optional.empty();
        }
        log.info("Doc {}: completed with {} pages, {} images, {} chunks",
            documentId, extraction.pageCount(), images.size(), chunks.size());

        saveImages(documentId, images);
        return Optional.of(chunks);
    }

    private CompletableFuture<List<PageImage>> startRendering(UUID documentId, byte[] pdf) {
        try {
            return CompletableFuture.supplyAsync(() -> pageRenderer.renderPages(documentId, pdf), renderExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Doc {}: render queue full, continuing without images: {}", documentId, e.getMessage());
            return CompletableFuture.completedFuture(List.of());
        }
    }

    private List<PageImage> awaitRendering(UUID documentId, CompletableFuture<List<PageImage>> rendering) {
        try {
            return rendering.get(renderProperties.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            rendering.cancel(true);
            log.warn("Doc {}: page rendering timed out after {}", documentId, renderProperties.timeout());
        } catch (ExecutionException e) {
            log.warn("Doc {}: page rendering failed: {}", documentId, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Doc {}: interrupted while waiting for page rendering", documentId);
        }
        return List.of();
    }

    private void saveImages(UUID documentId, List<PageImage> images) {
        try {
            pageImageRepository.saveAll(documentId, images);
        } catch (DataAccessException e) {
            log.warn("Doc {}: could not save page images: {}", documentId, e.getMessage());
        }
    }

    private void buildSearchIndex(UUID documentId, UUID userId, List<TextChunk> chunks) {
        if (chunks.isEmpty() || !embeddingService.isConfigured()) {
            log.info("Doc {}: nothing to index ({})", documentId,
                chunks.isEmpty() ? "no chunks" : "embedding provider not configured");
            clearSearchIndex(documentId, userId);
            return;
        }

        if (!documentRepository.updateEmbeddingStatus(documentId, ProcessingStatus.PROCESSING)) {
            log.warn("Doc {}: deleted before indexing", documentId);
            return;
        }

        try {
            int indexed = vectorStore.index(userId, documentId, chunks);
            documentRepository.updateEmbeddingStatus(documentId, ProcessingStatus.COMPLETED);
            log.info("Doc {}: search index ready ({} chunks)", documentId, indexed);
        } catch (RuntimeException e) {
            log.error("Doc {}: indexing failed, search unavailable: {}", documentId, e.getMessage(), e);
            documentRepository.updateEmbeddingStatus(documentId, ProcessingStatus.FAILED);
        }
    }

    /**
     * Indexing an empty chunk list drops whatever an earlier run left behind.
     */
    private void clearSearchIndex(UUID documentId, UUID userId) {
        try {
            vectorStore.index(userId, documentId, List.of());
            documentRepository.updateEmbeddingStatus(documentId, ProcessingStatus.COMPLETED);
        } catch (RuntimeException e) {
            log.error("Doc {}: could not clear previous search index: {}", documentId, e.getMessage(), e);
            documentRepository.updateEmbeddingStatus(documentId, ProcessingStatus.FAILED);
        }
    }

    private void failQuietly(UUID documentId, String error) {
        try {
            documentRepository.markFailed(documentId, error == null ? "Processing failed" : error);
        } catch (DataAccessException e) {
            log.error("Doc {}: could not record failure: {}", documentId, e.getMessage());
        }
    }
}
