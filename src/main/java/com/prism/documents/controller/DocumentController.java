package com.prism.documents.controller;

import com.prism.documents.service.DocumentService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/documents")
@Validated
@RequiredArgsConstructor
public class DocumentController {

    public static final String USER_HEADER = "X-User-Id";

    private final DocumentService documentService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> uploadDocument(
        @RequestHeader(USER_HEADER) UUID userId,
        @RequestParam("file") MultipartFile file) {

        DocumentResponse response = documentService.upload(file, userId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping
    public ResponseEntity<DocumentListResponse> listDocuments(
        @RequestHeader(USER_HEADER) UUID userId,
        @RequestParam(defaultValue = "1") @Min(1) int page,
        @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {

        return ResponseEntity.ok(documentService.listDocuments(userId, page, size));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(
        @RequestHeader(USER_HEADER) UUID userId,
        @PathVariable UUID id) {

        return ResponseEntity.ok(documentService.getDocument(id, userId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDocument(
        @RequestHeader(USER_HEADER) UUID userId,
        @PathVariable UUID id) {

        documentService.deleteDocument(id, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/images")
    public ResponseEntity<List<PageImageResponse>> getDocumentImages(
        @RequestHeader(USER_HEADER) UUID userId,
        @PathVariable UUID id) {

        List<PageImageResponse> images = documentService.getDocumentImages(id, userId).stream()
            .map(PageImageResponse::from)
            .toList();
        return ResponseEntity.ok(images);
    }

    @PostMapping("/{id}/reprocess")
    public ResponseEntity<DocumentResponse> reprocessDocument(
        @RequestHeader(USER_HEADER) UUID userId,
        @PathVariable UUID id) {

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(documentService.reprocessDocument(id, userId));
    }
}
