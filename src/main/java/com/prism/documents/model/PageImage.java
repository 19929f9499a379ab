package com.prism.documents.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PageImage(
    UUID id,
    UUID documentId,
    int pageNumber,
    int imageIndex,
    String storagePath,
    int width,
    int height,
    String format,
    long fileSize,
    OffsetDateTime createdAt
) {

    public static final int PAGE_RENDER_INDEX = 0;

    public static PageImage rendered(int pageNumber, String storagePath, int width, int height, String format, long fileSize) {
        return new PageImage(null, null, pageNumber, PAGE_RENDER_INDEX, storagePath, width, height, format, fileSize, null);
    }

    public static PageImage embedded(
        int pageNumber, int imageIndex, String storagePath, int width, int height, String format, long fileSize
    ) {
        return new PageImage(null, null, pageNumber, imageIndex, storagePath, width, height, format, fileSize, null);
    }
}
