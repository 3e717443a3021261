package com.privatedocs.qa.service.catalog;

import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.model.IndexStats;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.access.AccessControlFilter;
import com.privatedocs.qa.service.access.AccessTags;
import com.privatedocs.qa.service.access.CallerIdentity;
import com.privatedocs.qa.service.embedding.EmbeddingService;
import com.privatedocs.qa.service.index.VectorIndex;
import com.privatedocs.qa.service.resilience.DocumentLockRegistry;
import com.privatedocs.qa.service.synthesis.GroundedSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class DefaultDocumentService implements DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DefaultDocumentService.class);

    private static final Comparator<DocumentSummary> BY_FILENAME = Comparator
            .comparing(DocumentSummary::filename, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(DocumentSummary::id);

    private final DocumentCatalog catalog;
    private final VectorIndex vectorIndex;
    private final AccessControlFilter accessControlFilter;
    private final DocumentLockRegistry lockRegistry;
    private final EmbeddingService embeddingService;
    private final GroundedSynthesizer synthesizer;

    public DefaultDocumentService(DocumentCatalog catalog,
                                  VectorIndex vectorIndex,
                                  AccessControlFilter accessControlFilter,
                                  DocumentLockRegistry lockRegistry,
                                  EmbeddingService embeddingService,
                                  GroundedSynthesizer synthesizer) {
        this.catalog = catalog;
        this.vectorIndex = vectorIndex;
        this.accessControlFilter = accessControlFilter;
        this.lockRegistry = lockRegistry;
        this.embeddingService = embeddingService;
        this.synthesizer = synthesizer;
    }

    @Override
    public List<DocumentSummary> listDocuments(CallerIdentity caller) {
        if (caller.admin()) {
            return catalog.listAll().stream().sorted(BY_FILENAME).toList();
        }
        Map<String, DocumentSummary> visible = new LinkedHashMap<>();
        catalog.listOwnedBy(caller.callerId()).forEach(document -> visible.put(document.id(), document));
        catalog.listIndexedWithAnyTag(caller.grantedTags()).forEach(document -> visible.putIfAbsent(document.id(), document));
        return visible.values().stream().sorted(BY_FILENAME).toList();
    }

    @Override
    public void deleteDocument(String documentId, CallerIdentity caller) {
        requireManageable(documentId, caller);
        lockRegistry.runWithLock(DocumentLockRegistry.documentKey(documentId), () -> {
            // catalog first: the document stops being readable before its chunks go
            boolean removed = catalog.delete(documentId);
            vectorIndex.delete(documentId);
            if (removed) {
                log.info("Deleted document {} on behalf of {}", documentId, caller.callerId());
            }
        });
    }

    @Override
    public DocumentSummary updateAccessTags(String documentId, Set<String> accessTags, CallerIdentity caller) {
        requireManageable(documentId, caller);
        Set<String> normalised = AccessTags.normalise(accessTags);
        return lockRegistry.withLock(DocumentLockRegistry.documentKey(documentId), () -> {
            DocumentSummary updated = catalog.updateAccessTags(documentId, normalised);
            vectorIndex.updateAccessTags(documentId, normalised);
            log.info("Updated access tags of document {} to {} on behalf of {}", documentId, normalised, caller.callerId());
            return updated;
        });
    }

    @Override
    public IndexStats getStats() {
        return new IndexStats(
                catalog.countAll(),
                catalog.countIndexed(),
                vectorIndex.countChunks(),
                embeddingService.modelName(),
                synthesizer.modelName());
    }

    @Override
    public long clearIndex(CallerIdentity caller) {
        if (!caller.admin()) {
            throw new DocQaException(ErrorKind.PERMISSION_DENIED, "Only administrators may clear the index");
        }
        long removed = lockRegistry.withExclusiveLock(() -> {
            long deleted = catalog.deleteAll();
            vectorIndex.clear();
            return deleted;
        });
        log.info("Index cleared by {} ({} documents removed)", caller.callerId(), removed);
        return removed;
    }

    private DocumentSummary requireManageable(String documentId, CallerIdentity caller) {
        DocumentSummary document = catalog.findById(documentId).orElse(null);
        if (document == null) {
            throw caller.admin()
                    ? new DocQaException(ErrorKind.NOT_FOUND, "Document " + documentId + " does not exist")
                    : new DocQaException(ErrorKind.PERMISSION_DENIED, "You do not have access to document " + documentId);
        }
        if (!accessControlFilter.canManage(caller, document)) {
            throw new DocQaException(ErrorKind.PERMISSION_DENIED, "You do not have access to document " + documentId);
        }
        return document;
    }
}
