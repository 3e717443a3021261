package com.privatedocs.qa.service.embedding;

import java.util.List;

public interface EmbeddingsClient {

    EmbeddingBatch embed(List<String> texts);

    String modelName();

    record EmbeddingBatch(List<float[]> vectors, String model, int dimensions) {}
}
