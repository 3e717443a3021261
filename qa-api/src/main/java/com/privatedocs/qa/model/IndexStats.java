package com.privatedocs.qa.model;

public record IndexStats(long totalDocuments,
                         long indexedDocuments,
                         long totalChunks,
                         String embeddingModel,
                         String llmModel) {
}
