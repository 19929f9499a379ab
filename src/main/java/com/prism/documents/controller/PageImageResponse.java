package com.prism.documents.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prism.documents.model.PageImage;

import java.util.UUID;

public record PageImageResponse(
    UUID id,

    @JsonProperty("page_number")
    int pageNumber,

    @JsonProperty("image_index")
    int imageIndex,

    @JsonProperty("storage_path")
    String storagePath,

    int width,

    int height,

    String format,

    @JsonProperty("file_size")
    long fileSize
) {

    public static PageImageResponse from(PageImage image) {
        return new PageImageResponse(
            image.id(),
            image.pageNumber(),
            image.imageIndex(),
            image.storagePath(),
            image.width(),
            image.height(),
            image.format(),
            image.fileSize()
        );
    }
}
