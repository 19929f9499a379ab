package com.prism.documents.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DocumentListResponse(
    List<DocumentResponse> documents,
    long total,
    int page,
    int size,
    @JsonProperty("total_pages")
    int totalPages
) {}
