package com.prism.documents.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record RankedChunk(
    String text,
    @JsonProperty("document_id") UUID documentId,
    @JsonProperty("document_name") String documentName,
    @JsonProperty("page_number") int pageNumber,
    double score
) {}
