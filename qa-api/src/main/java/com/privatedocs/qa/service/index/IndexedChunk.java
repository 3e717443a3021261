package com.privatedocs.qa.service.index;

import java.util.Set;

public record IndexedChunk(String chunkId,
                           String documentId,
                           String filename,
                           int sequenceIndex,
                           int start,
                           int end,
                           String text,
                           float[] embedding,
                           Set<String> accessTags) {

    public IndexedChunk {
        accessTags = accessTags == null ? Set.of() : Set.copyOf(accessTags);
    }

    public static String chunkId(String documentId, int sequenceIndex) {
        return documentId + "-" + sequenceIndex;
    }

    IndexedChunk withAccessTags(Set<String> tags) {
        return new IndexedChunk(chunkId, documentId, filename, sequenceIndex, start, end, text, embedding, tags);
    }
}
