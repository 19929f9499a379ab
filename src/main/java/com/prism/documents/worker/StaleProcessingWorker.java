package com.prism.documents.worker;

import com.prism.documents.config.WorkerProperties;
import com.prism.documents.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Fails pipelines that stopped making progress, e.g. after a restart. A
 * reindex interrupted between delete and insert shows up as a failed
 * embedding status instead of an empty index.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StaleProcessingWorker {

    static final String INTERRUPTED_ERROR = "Processing interrupted";

    private final DocumentRepository documentRepository;
    private final WorkerProperties properties;

    @Scheduled(fixedDelayString = "${app.worker.check-interval-ms:60000}")
    public void failStalePipelines() {
        log.debug("Checking for documents stuck in processing...");

        List<UUID> staleDocuments = documentRepository.failStaleProcessing(
            properties.staleThresholdMinutes(), INTERRUPTED_ERROR);
        List<UUID> staleIndexes = documentRepository.failStaleEmbedding(properties.staleThresholdMinutes());

        if (!staleDocuments.isEmpty()) {
            log.warn("Marked {} stuck documents as failed: {}", staleDocuments.size(), staleDocuments);
        }
        if (!staleIndexes.isEmpty()) {
            log.warn("Marked {} stuck search indexes as failed: {}", staleIndexes.size(), staleIndexes);
        }
    }
}
