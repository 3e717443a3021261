package com.privatedocs.qa.service.ingestion;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Character windows with overlap. A window is cut at the last paragraph break, or failing that the last whitespace,
 * found in its second half, so words stay whole. Spans are offsets into the text passed in.
 */
@Component
public class FixedSizeTextChunker implements TextChunker {

    private final int chunkSize;
    private final int overlap;

    public FixedSizeTextChunker(@Value("${docqa.ingest.chunk-size:1000}") int chunkSize,
                                @Value("${docqa.ingest.overlap:200}") int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("docqa.ingest.chunk-size must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("docqa.ingest.overlap must be in [0, chunk-size)");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    @Override
    public List<TextChunk> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        int length = text.length();
        List<TextChunk> chunks = new ArrayList<>();
        int start = skipWhitespace(text, 0);
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                int cut = findCut(text, start, end);
                if (cut > start) {
                    end = cut;
                }
            }
            int trimmedEnd = end;
            while (trimmedEnd > start && Character.isWhitespace(text.charAt(trimmedEnd - 1))) {
                trimmedEnd--;
            }
            if (trimmedEnd > start) {
                chunks.add(new TextChunk(chunks.size(), start, trimmedEnd, text.substring(start, trimmedEnd)));
            }
            if (end >= length) {
                break;
            }
            start = skipWhitespace(text, nextStart(text, start, end));
        }
        return List.copyOf(chunks);
    }

    private int findCut(String text, int start, int end) {
        int minCut = start + Math.max(1, chunkSize / 2);
        for (int i = end; i > minCut; i--) {
            if (text.charAt(i) == '\n' && text.charAt(i - 1) == '\n') {
                return i - 1;
            }
        }
        for (int i = end; i >= minCut; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private int nextStart(String text, int start, int end) {
        if (overlap == 0) {
            return end;
        }
        int next = end - overlap;
        // do not begin the next window mid-word
        while (next < end && next > 0 && !Character.isWhitespace(text.charAt(next - 1))) {
            next++;
        }
        return next <= start ? end : next;
    }

    private static int skipWhitespace(String text, int index) {
        int position = index;
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
        return position;
    }
}
