package com.prism.documents.model;

public record ExtractionResult(
    String text,
    int pageCount,
    DocumentMetadata metadata
) {}
