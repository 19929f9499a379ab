package com.prism.documents.service;

import java.util.List;

public interface EmbeddingService {
    boolean isConfigured();
    int dimension();
    float[] embed(String text);
    List<float[]> embedBatch(List<String> texts);
}
