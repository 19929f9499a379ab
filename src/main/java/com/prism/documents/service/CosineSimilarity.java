package com.prism.documents.service;

import com.prism.documents.exception.DimensionMismatchException;

public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * {@code dot(a, b) / (|a| * |b|)}, or 0 when either vector has zero norm.
     */
    public static double similarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }

        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }
        double score = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, score));
    }
}
