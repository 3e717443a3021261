package com.privatedocs.qa.service.embedding;

import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

@Component
@Profile("!template")
public class WebClientEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;
    private final String model;

    public WebClientEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                     @Value("${docqa.embeddings.model:all-MiniLM-L6-v2}") String model) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.model = model;
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new DocQaException(ErrorKind.VALIDATION, "No text provided for embedding");
        }
        EmbedResponse response = embeddingsWebClient.post()
                .uri("/embed")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new EmbedRequest(model, texts))
                .retrieve()
                .bodyToMono(EmbedResponse.class)
                .onErrorResume(WebClientResponseException.class, exception -> {
                    log.warn("Embeddings service returned {}: {}", exception.getStatusCode(), exception.getResponseBodyAsString());
                    return Mono.error(new DocQaException(ErrorKind.EMBEDDING_UNAVAILABLE,
                            "Embeddings service returned " + exception.getStatusCode().value(), exception));
                })
                .block();
        if (response == null || response.vectors() == null || response.vectors().size() != texts.size()) {
            throw new DocQaException(ErrorKind.EMBEDDING_UNAVAILABLE, "Embeddings response size did not match the request");
        }
        List<float[]> vectors = new ArrayList<>(response.vectors().size());
        for (List<Double> values : response.vectors()) {
            float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            vectors.add(vector);
        }
        String responseModel = response.model() == null || response.model().isBlank() ? model : response.model();
        int dimensions = response.dimensions() > 0 ? response.dimensions() : vectors.get(0).length;
        return new EmbeddingBatch(List.copyOf(vectors), responseModel, dimensions);
    }

    @Override
    public String modelName() {
        return model;
    }

    record EmbedRequest(String model, List<String> texts) {}

    record EmbedResponse(List<List<Double>> vectors, String model, int dimensions) {}
}
