package com.prism.documents.controller;

import com.prism.documents.config.SearchProperties;
import com.prism.documents.model.RankedChunk;
import com.prism.documents.model.SearchOptions;
import com.prism.documents.service.DocumentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SearchController.class)
@EnableConfigurationProperties(SearchProperties.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DocumentService documentService;

    private final UUID userId = UUID.randomUUID();

    @Test
    @DisplayName("Should return ranked chunks with 200 OK")
    void search_ShouldReturnResults_WhenQueryIsProvided() throws Exception {
        UUID docId = UUID.randomUUID();
        when(documentService.searchDocuments(eq(userId), eq("goods receipt"), any()))
            .thenReturn(List.of(
                new RankedChunk("Post the goods receipt with MIGO", docId, "guide.pdf", 2, 0.91),
                new RankedChunk("Check the purchase order", docId, "guide.pdf", 1, 0.55)));

        mockMvc.perform(get("/search").header("X-User-Id", userId).param("q", "goods receipt"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query").value("goods receipt"))
            .andExpect(jsonPath("$.results[0].document_id").value(docId.toString()))
            .andExpect(jsonPath("$.results[0].document_name").value("guide.pdf"))
            .andExpect(jsonPath("$.results[0].page_number").value(2))
            .andExpect(jsonPath("$.results[0].score").value(0.91))
            .andExpect(jsonPath("$.results[1].text").value("Check the purchase order"));
    }

    @Test
    @DisplayName("Should apply configured defaults when options are omitted")
    void search_ShouldUseDefaults() throws Exception {
        when(documentService.searchDocuments(any(), any(), any())).thenReturn(List.of());

        mockMvc.perform(get("/search").header("X-User-Id", userId).param("q", "MIGO"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results").isEmpty());

        ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
        verify(documentService).searchDocuments(eq(userId), eq("MIGO"), options.capture());
        assertThat(options.getValue().topK()).isEqualTo(5);
        assertThat(options.getValue().minScore()).isEqualTo(0.3);
        assertThat(options.getValue().documentId()).isEmpty();
    }

    @Test
    @DisplayName("Should pass document scope and explicit options through")
    void search_ShouldPassExplicitOptions() throws Exception {
        UUID docId = UUID.randomUUID();
        when(documentService.searchDocuments(any(), any(), any())).thenReturn(List.of());

        mockMvc.perform(get("/search").header("X-User-Id", userId)
                .param("q", "MIGO")
                .param("document_id", docId.toString())
                .param("top_k", "10")
                .param("min_score", "0.5"))
            .andExpect(status().isOk());

        verify(documentService).searchDocuments(userId, "MIGO", new SearchOptions(10, Optional.of(docId), 0.5));
    }

    @Test
    @DisplayName("Should return 400 Bad Request when query 'q' is missing")
    void search_ShouldReturn400_WhenQueryIsMissing() throws Exception {
        mockMvc.perform(get("/search").header("X-User-Id", userId))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Parameter 'q' is missing"));
    }

    @Test
    @DisplayName("Should return 400 Bad Request when top_k is out of range")
    void search_ShouldReturn400_WhenTopKOutOfRange() throws Exception {
        mockMvc.perform(get("/search").header("X-User-Id", userId).param("q", "MIGO").param("top_k", "0"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(documentService);
    }
}
