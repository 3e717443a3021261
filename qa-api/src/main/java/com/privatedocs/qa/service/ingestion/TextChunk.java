package com.privatedocs.qa.service.ingestion;

public record TextChunk(int sequenceIndex, int start, int end, String text) {
}
