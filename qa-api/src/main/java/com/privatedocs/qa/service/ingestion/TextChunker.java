package com.privatedocs.qa.service.ingestion;

import java.util.List;

public interface TextChunker {

    List<TextChunk> chunk(String text);
}
