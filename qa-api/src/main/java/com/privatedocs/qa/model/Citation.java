package com.privatedocs.qa.model;

public record Citation(String documentId,
                       String chunkId,
                       String filename,
                       int start,
                       int end,
                       String snippet) {
}
