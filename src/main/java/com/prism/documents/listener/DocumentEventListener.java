package com.prism.documents.listener;

import com.prism.documents.event.DocumentIngestedEvent;
import com.prism.documents.service.DocumentIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentEventListener {

    private final DocumentIngestionService ingestionService;

    @Async("ingestionTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleIngestion(DocumentIngestedEvent event) {
        log.info("Starting async ingestion for doc: {}", event.documentId());
        ingestionService.processDocument(event.documentId(), event.userId(), event.filePath());
    }
}
