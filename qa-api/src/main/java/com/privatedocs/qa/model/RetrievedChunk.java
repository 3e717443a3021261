package com.privatedocs.qa.model;

public record RetrievedChunk(
        String documentId,
        String chunkId,
        String filename,
        int sequenceIndex,
        int start,
        int end,
        String text,
        double score
) {
}
