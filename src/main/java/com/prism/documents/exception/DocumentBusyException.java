package com.prism.documents.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class DocumentBusyException extends RuntimeException {
    private final UUID documentId;

    public DocumentBusyException(UUID documentId) {
        super("Document is already being processed: " + documentId);
        this.documentId = documentId;
    }
}
