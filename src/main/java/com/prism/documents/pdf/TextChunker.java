package com.prism.documents.pdf;

import com.prism.documents.config.ChunkingProperties;
import com.prism.documents.model.TextChunk;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size character windows with overlap over whitespace-normalized text.
 * Page numbers are attributed proportionally to the window start.
 */
@Component
@RequiredArgsConstructor
public class TextChunker {

    private final ChunkingProperties properties;

    public List<TextChunk> chunk(String text, int pageCount) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }

        int length = normalized.length();
        int step = properties.size() - properties.overlap();
        List<TextChunk> chunks = new ArrayList<>();

        for (int start = 0; start < length; start += step) {
            int end = Math.min(start + properties.size(), length);
            String window = normalized.substring(start, end).trim();
            if (window.length() >= properties.minLength()) {
                chunks.add(new TextChunk(window, chunks.size(), pageOf(start, length, pageCount)));
            }
            if (end == length) {
                break;
            }
        }
        return chunks;
    }

    static String normalize(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }

    static int pageOf(int start, int length, int pageCount) {
        if (pageCount <= 1) {
            return 1;
        }
        int page = (int) Math.ceil((double) start / length * pageCount);
        return Math.max(1, Math.min(page, pageCount));
    }
}
