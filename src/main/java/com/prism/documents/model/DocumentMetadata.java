package com.prism.documents.model;

import java.util.List;

public record DocumentMetadata(
    String moduleTag,
    List<String> tcodes,
    List<String> errorCodes,
    String referenceNumber
) {

    public static DocumentMetadata empty() {
        return new DocumentMetadata(null, List.of(), List.of(), null);
    }
}
