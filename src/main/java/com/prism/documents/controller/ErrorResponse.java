package com.prism.documents.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
