package com.privatedocs.qa.service.index;

import java.util.List;
import java.util.Set;

public interface VectorIndex {

    /**
     * Publishes a complete chunk generation for the document, replacing any previous one in a single step.
     */
    void replaceDocument(String documentId, List<IndexedChunk> chunks);

    void delete(String documentId);

    /**
     * Ranks only chunks whose document id is in {@code allowedDocumentIds}; chunks of other documents are never scored.
     */
    List<ScoredChunk> search(float[] queryVector, Set<String> allowedDocumentIds, int k);

    void updateAccessTags(String documentId, Set<String> accessTags);

    long countChunks();

    int countChunks(String documentId);

    void clear();
}
