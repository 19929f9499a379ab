package com.prism.documents.controller;

import com.prism.documents.model.RankedChunk;

import java.util.List;

public record SearchResponse(
    String query,
    List<RankedChunk> results
) {}
