package com.prism.documents.exception;

import lombok.Getter;

@Getter
public class RenderException extends RuntimeException {
    private final int pageNumber;

    public RenderException(int pageNumber, Throwable cause) {
        super("Failed to render page " + pageNumber + ": " + cause.getMessage(), cause);
        this.pageNumber = pageNumber;
    }
}
