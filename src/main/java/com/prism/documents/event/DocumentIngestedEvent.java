package com.prism.documents.event;

import java.util.UUID;

public record DocumentIngestedEvent(UUID documentId, UUID userId, String filePath) {}
