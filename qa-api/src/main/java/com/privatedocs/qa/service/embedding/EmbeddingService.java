package com.privatedocs.qa.service.embedding;

import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Calls the configured {@link EmbeddingsClient} with a per-attempt timeout and the embedding retry policy.
 * Exhausted retries surface as {@link ErrorKind#EMBEDDING_UNAVAILABLE}.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingsClient embeddingsClient;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;

    public EmbeddingService(EmbeddingsClient embeddingsClient,
                            @Qualifier("embeddingRetryPolicy") RetryPolicy retryPolicy,
                            @Value("${docqa.embeddings.timeout-seconds:30}") long timeoutSeconds) {
        this.embeddingsClient = embeddingsClient;
        this.retryPolicy = retryPolicy;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public EmbeddingsClient.EmbeddingBatch embedAll(List<String> texts) {
        Mono<EmbeddingsClient.EmbeddingBatch> attempt = Mono.fromCallable(() -> checked(texts, embeddingsClient.embed(texts)))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout);
        return retryPolicy.apply(attempt)
                .onErrorMap(this::unavailable)
                .block();
    }

    public float[] embedQuery(String question) {
        return embedAll(List.of(question)).vectors().get(0);
    }

    public String modelName() {
        return embeddingsClient.modelName();
    }

    private EmbeddingsClient.EmbeddingBatch checked(List<String> texts, EmbeddingsClient.EmbeddingBatch batch) {
        if (batch == null || batch.vectors() == null || batch.vectors().size() != texts.size()) {
            throw new DocQaException(ErrorKind.EMBEDDING_UNAVAILABLE, "Embedder returned a vector count that does not match the input");
        }
        return batch;
    }

    private Throwable unavailable(Throwable failure) {
        if (failure instanceof DocQaException docQa && docQa.kind() == ErrorKind.EMBEDDING_UNAVAILABLE) {
            log.error("Embedding failed after retries: {}", failure.getMessage());
            return failure;
        }
        String reason = failure instanceof TimeoutException ? "Embedding call timed out" : "Embedding service unavailable";
        log.error("{} after retries: {}", reason, failure.getMessage());
        return new DocQaException(ErrorKind.EMBEDDING_UNAVAILABLE, reason, failure);
    }
}
