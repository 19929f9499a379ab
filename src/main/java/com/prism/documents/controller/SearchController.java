package com.prism.documents.controller;

import com.prism.documents.config.SearchProperties;
import com.prism.documents.model.SearchOptions;
import com.prism.documents.service.DocumentService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/search")
@Validated
@RequiredArgsConstructor
public class SearchController {

    private final DocumentService documentService;
    private final SearchProperties searchProperties;

    @GetMapping
    public ResponseEntity<SearchResponse> search(
        @RequestHeader(DocumentController.USER_HEADER) UUID userId,
        @RequestParam(name = "q") String query,
        @RequestParam(name = "document_id", required = false) UUID documentId,
        @RequestParam(name = "top_k", required = false) @Min(1) @Max(100) Integer topK,
        @RequestParam(name = "min_score", required = false) Double minScore) {

        SearchOptions options = new SearchOptions(
            Optional.ofNullable(topK).orElse(searchProperties.topK()),
            Optional.ofNullable(documentId),
            Optional.ofNullable(minScore).orElse(searchProperties.minScore())
        );

        return ResponseEntity.ok(new SearchResponse(query, documentService.searchDocuments(userId, query, options)));
    }
}
