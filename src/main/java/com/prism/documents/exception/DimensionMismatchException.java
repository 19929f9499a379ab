package com.prism.documents.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends RuntimeException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Unexpected embedding dimension: got " + actual + ", expected " + expected);
        this.expected = expected;
        this.actual = actual;
    }
}
