package com.prism.documents.service;

import com.prism.documents.controller.DocumentListResponse;
import com.prism.documents.controller.DocumentResponse;
import com.prism.documents.event.DocumentIngestedEvent;
import com.prism.documents.exception.DocumentBusyException;
import com.prism.documents.exception.DocumentNotFoundException;
import com.prism.documents.exception.InvalidUploadException;
import com.prism.documents.infra.LocalFileStorage;
import com.prism.documents.model.Document;
import com.prism.documents.model.PageImage;
import com.prism.documents.model.RankedChunk;
import com.prism.documents.model.SearchOptions;
import com.prism.documents.pdf.PageRenderer;
import com.prism.documents.repository.DocumentRepository;
import com.prism.documents.repository.PageImageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private static final String PDF_CONTENT_TYPE = "application/pdf";

    private final DocumentRepository documentRepository;
    private final PageImageRepository pageImageRepository;
    private final VectorStoreService vectorStore;
    private final PageRenderer pageRenderer;
    private final LocalFileStorage storage;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public DocumentResponse upload(MultipartFile file, UUID userId) {
        validate(file);
        String originalName = file.getOriginalFilename();

        Path stored;
        try (InputStream content = file.getInputStream()) {
            stored = storage.storeUpload(content, originalName);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read upload " + originalName, e);
        }

        Document saved = documentRepository.save(
            Document.pending(userId, originalName, stored.toString(), file.getSize()));
        log.info("Doc {}: uploaded '{}' ({} bytes) for user {}", saved.id(), originalName, file.getSize(), userId);

        eventPublisher.publishEvent(new DocumentIngestedEvent(saved.id(), userId, saved.storagePath()));
        return DocumentResponse.from(saved, null);
    }

    private static void validate(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidUploadException("Uploaded file is empty");
        }
        String name = file.getOriginalFilename();
        boolean pdfName = name != null && name.toLowerCase().endsWith(".pdf");
        boolean pdfType = PDF_CONTENT_TYPE.equalsIgnoreCase(file.getContentType());
        if (!pdfName && !pdfType) {
            throw new InvalidUploadException("Only PDF files are supported");
        }
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentResponse getDocument(UUID documentId, UUID userId) {
        Document doc = findOwned(documentId, userId);
        return DocumentResponse.from(doc, vectorStore.countDocumentEmbeddings(documentId));
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentListResponse listDocuments(UUID userId, int page, int size) {
        int safePage = Math.max(page, 1);
        int safeSize = Math.max(1, Math.min(size, 100));

        List<DocumentResponse> documents = documentRepository
            .listByUser(userId, safeSize, (safePage - 1) * safeSize)
            .stream()
            .map(doc -> DocumentResponse.from(doc, null))
            .toList();
        long total = documentRepository.countByUser(userId);
        int totalPages = (int) ((total + safeSize - 1) / safeSize);

        return new DocumentListResponse(documents, total, safePage, safeSize, totalPages);
    }

    /**
     * Removes the index, the row (images cascade), the rendered pages and the
     * original upload. A pipeline still running for the document turns its
     * remaining writes into no-ops.
     */
    @Override
    public void deleteDocument(UUID documentId, UUID userId) {
        Document doc = findOwned(documentId, userId);

        int embeddings = vectorStore.deleteDocumentEmbeddings(documentId);
        if (!documentRepository.delete(documentId, userId)) {
            throw new DocumentNotFoundException(documentId);
        }
        pageRenderer.deleteDocumentImages(documentId);
        storage.deleteFile(doc.storagePath());

        log.info("Doc {}: deleted with {} embeddings", documentId, embeddings);
    }

    @Override
    public List<PageImage> getDocumentImages(UUID documentId) {
        return pageImageRepository.findByDocumentId(documentId);
    }

    @Override
    public List<PageImage> getDocumentImages(UUID documentId, UUID userId) {
        findOwned(documentId, userId);
        return getDocumentImages(documentId);
    }

    @Override
    @Transactional
    public DocumentResponse reprocessDocument(UUID documentId, UUID userId) {
        Document doc = findOwned(documentId, userId);
        if (!documentRepository.resetForReprocess(documentId, userId)) {
            throw new DocumentBusyException(documentId);
        }
        pageImageRepository.deleteByDocumentId(documentId);
        pageRenderer.deleteDocumentImages(documentId);
        vectorStore.deleteDocumentEmbeddings(documentId);

        log.info("Doc {}: queued for reprocessing", documentId);
        eventPublisher.publishEvent(new DocumentIngestedEvent(documentId, userId, doc.storagePath()));
        return DocumentResponse.from(findOwned(documentId, userId), null);
    }

    @Override
    public List<RankedChunk> searchDocuments(UUID userId, String query, SearchOptions options) {
        return vectorStore.search(userId, query, options);
    }

    private Document findOwned(UUID documentId, UUID userId) {
        return documentRepository.findByIdAndUser(documentId, userId)
            .orElseThrow(() -> {
                log.warn("Document {} not found for user {}", documentId, userId);
                return new DocumentNotFoundException(documentId);
            });
    }
}
