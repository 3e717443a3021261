package com.privatedocs.qa.service.index;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparing(scored -> scored.chunk().documentId())
            .thenComparingInt(scored -> scored.chunk().sequenceIndex());

    // Each value is an immutable generation; writers swap the whole list, readers never see a partial one.
    private final Map<String, List<IndexedChunk>> generations = new ConcurrentHashMap<>();

    @Override
    public void replaceDocument(String documentId, List<IndexedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            delete(documentId);
            return;
        }
        for (IndexedChunk chunk : chunks) {
            if (!documentId.equals(chunk.documentId())) {
                throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " does not belong to document " + documentId);
            }
        }
        List<IndexedChunk> generation = chunks.stream()
                .sorted(Comparator.comparingInt(IndexedChunk::sequenceIndex))
                .toList();
        generations.put(documentId, generation);
        log.debug("Published {} chunks for document {}", generation.size(), documentId);
    }

    @Override
    public void delete(String documentId) {
        List<IndexedChunk> removed = generations.remove(documentId);
        if (removed != null) {
            log.debug("Removed {} chunks for document {}", removed.size(), documentId);
        }
    }

    @Override
    public List<ScoredChunk> search(float[] queryVector, Set<String> allowedDocumentIds, int k) {
        if (k <= 0 || allowedDocumentIds == null || allowedDocumentIds.isEmpty() || queryVector == null) {
            return List.of();
        }
        List<ScoredChunk> candidates = new ArrayList<>();
        for (String documentId : allowedDocumentIds) {
            List<IndexedChunk> generation = generations.get(documentId);
            if (generation == null) {
                continue;
            }
            for (IndexedChunk chunk : generation) {
                candidates.add(new ScoredChunk(chunk, VectorMath.cosine(queryVector, chunk.embedding())));
            }
        }
        candidates.sort(RANKING);
        return candidates.size() <= k ? List.copyOf(candidates) : List.copyOf(candidates.subList(0, k));
    }

    @Override
    public void updateAccessTags(String documentId, Set<String> accessTags) {
        generations.computeIfPresent(documentId, (id, generation) -> generation.stream()
                .map(chunk -> chunk.withAccessTags(accessTags))
                .toList());
    }

    @Override
    public long countChunks() {
        return generations.values().stream().mapToLong(List::size).sum();
    }

    @Override
    public int countChunks(String documentId) {
        List<IndexedChunk> generation = generations.get(documentId);
        return generation == null ? 0 : generation.size();
    }

    @Override
    @PreDestroy
    public void clear() {
        generations.clear();
    }
}
