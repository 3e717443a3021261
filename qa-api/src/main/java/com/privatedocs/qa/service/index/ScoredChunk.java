package com.privatedocs.qa.service.index;

public record ScoredChunk(IndexedChunk chunk, double score) {
}
