package com.prism.documents.model;

public record TextChunk(
    String text,
    int chunkIndex,
    int pageNumber
) {}
