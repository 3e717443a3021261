package com.privatedocs.qa.service.retrieval;

import com.privatedocs.qa.model.RetrievedChunk;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.embedding.EmbeddingService;
import com.privatedocs.qa.service.index.IndexedChunk;
import com.privatedocs.qa.service.index.ScoredChunk;
import com.privatedocs.qa.service.index.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Service
public class PermissionFilteredRetriever implements DenseRetriever {

    private static final Logger log = LoggerFactory.getLogger(PermissionFilteredRetriever.class);

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final int topK;
    private final Double minScore;

    public PermissionFilteredRetriever(EmbeddingService embeddingService,
                                       VectorIndex vectorIndex,
                                       @Value("${docqa.retrieval.top-k:5}") int topK,
                                       @Value("${docqa.retrieval.min-score:#{null}}") Double minScore) {
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
        this.topK = topK;
        this.minScore = minScore;
    }

    @Override
    public List<RetrievedChunk> search(String question, Set<String> allowedDocumentIds) {
        if (allowedDocumentIds == null || allowedDocumentIds.isEmpty() || topK <= 0) {
            return List.of();
        }
        float[] queryVector = embeddingService.embedQuery(question);
        List<ScoredChunk> ranked;
        try {
            ranked = vectorIndex.search(queryVector, allowedDocumentIds, topK);
        } catch (IllegalArgumentException ex) {
            // indexed vectors came from a different embedding model or dimension setting
            log.error("Question embedding does not fit the index: {}", ex.getMessage());
            throw new DocQaException(ErrorKind.EMBEDDING_UNAVAILABLE,
                    "Question embedding does not match the indexed documents; re-index after changing the embedding model", ex);
        }
        List<RetrievedChunk> retrieved = ranked.stream()
                .filter(scored -> minScore == null || scored.score() >= minScore)
                .map(PermissionFilteredRetriever::toRetrievedChunk)
                .toList();
        log.debug("Retrieved {} of {} ranked chunks across {} permitted documents", retrieved.size(), ranked.size(), allowedDocumentIds.size());
        return retrieved;
    }

    private static RetrievedChunk toRetrievedChunk(ScoredChunk scored) {
        IndexedChunk chunk = scored.chunk();
        return new RetrievedChunk(
                chunk.documentId(),
                chunk.chunkId(),
                chunk.filename(),
                chunk.sequenceIndex(),
                chunk.start(),
                chunk.end(),
                chunk.text(),
                scored.score());
    }
}
