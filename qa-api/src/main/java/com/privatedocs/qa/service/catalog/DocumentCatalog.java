package com.privatedocs.qa.service.catalog;

import com.privatedocs.qa.model.DocumentFormat;
import com.privatedocs.qa.model.DocumentStatus;
import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.persistence.entity.DocumentEntity;
import com.privatedocs.qa.persistence.repository.DocumentRepository;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import com.privatedocs.qa.service.access.AccessTags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Source of truth for document status. Chunks in the vector index are only visible for documents this catalog marks INDEXED.
 */
@Service
@Transactional
public class DocumentCatalog {

    private static final Logger log = LoggerFactory.getLogger(DocumentCatalog.class);

    private final DocumentRepository repository;
    private final Clock clock;

    public DocumentCatalog(DocumentRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<DocumentSummary> findById(String documentId) {
        return repository.findById(documentId).map(DocumentCatalog::toSummary);
    }

    @Transactional(readOnly = true)
    public Optional<DocumentSummary> findLatestByOwnerAndHash(String ownerId, String contentHash) {
        return repository.findTopByOwnerIdAndContentHashOrderByVersionDesc(ownerId, contentHash)
                .map(DocumentCatalog::toSummary);
    }

    public DocumentSummary beginRun(NewRun run) {
        DocumentEntity entity = repository.findById(run.documentId()).orElse(null);
        if (entity == null) {
            entity = new DocumentEntity();
            entity.setId(run.documentId());
            entity.setVersion(1);
            entity.setCreatedAt(now());
        } else {
            entity.setVersion(entity.getVersion() + 1);
        }
        entity.setContentHash(run.contentHash());
        entity.setFilename(run.filename());
        entity.setFormat(run.format());
        entity.setSizeBytes(run.sizeBytes());
        entity.setOwnerId(run.ownerId());
        entity.setAccessTags(new HashSet<>(AccessTags.normalise(run.accessTags())));
        entity.setStatus(DocumentStatus.PENDING);
        entity.setIndexedAt(null);
        entity.setChunkCount(0);
        entity.setFailureReason(null);
        return toSummary(repository.save(entity));
    }

    public DocumentSummary markIndexed(String documentId, int chunkCount) {
        DocumentEntity entity = require(documentId);
        entity.setStatus(DocumentStatus.INDEXED);
        entity.setIndexedAt(now());
        entity.setChunkCount(chunkCount);
        entity.setFailureReason(null);
        return toSummary(repository.save(entity));
    }

    public DocumentSummary markFailed(String documentId, String reason) {
        DocumentEntity entity = require(documentId);
        entity.setStatus(DocumentStatus.FAILED);
        entity.setChunkCount(0);
        entity.setFailureReason(truncate(reason));
        return toSummary(repository.save(entity));
    }

    public DocumentSummary updateAccessTags(String documentId, Collection<String> accessTags) {
        DocumentEntity entity = require(documentId);
        entity.setAccessTags(new HashSet<>(AccessTags.normalise(accessTags)));
        return toSummary(repository.save(entity));
    }

    public boolean delete(String documentId) {
        if (!repository.existsById(documentId)) {
            return false;
        }
        repository.deleteById(documentId);
        repository.flush();
        return true;
    }

    public long deleteAll() {
        long removed = repository.count();
        repository.deleteAll();
        log.info("Removed {} documents from the catalog", removed);
        return removed;
    }

    @Transactional(readOnly = true)
    public List<DocumentSummary> listAll() {
        return repository.findAll().stream().map(DocumentCatalog::toSummary).toList();
    }

    @Transactional(readOnly = true)
    public List<DocumentSummary> listOwnedBy(String ownerId) {
        return repository.findByOwnerId(ownerId).stream().map(DocumentCatalog::toSummary).toList();
    }

    @Transactional(readOnly = true)
    public List<DocumentSummary> listIndexedWithAnyTag(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        return repository.findDistinctByStatusAndAccessTagsIn(DocumentStatus.INDEXED, tags).stream()
                .map(DocumentCatalog::toSummary)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<String> indexedDocumentIds() {
        return repository.findIdsByStatus(DocumentStatus.INDEXED);
    }

    @Transactional(readOnly = true)
    public List<String> indexedDocumentIdsOwnedBy(String ownerId) {
        return repository.findIdsByStatusAndOwnerId(DocumentStatus.INDEXED, ownerId);
    }

    @Transactional(readOnly = true)
    public List<String> indexedDocumentIdsWithAnyTag(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        return repository.findIdsByStatusAndAnyTag(DocumentStatus.INDEXED, tags);
    }

    @Transactional(readOnly = true)
    public long countAll() {
        return repository.count();
    }

    @Transactional(readOnly = true)
    public long countIndexed() {
        return repository.countByStatus(DocumentStatus.INDEXED);
    }

    private DocumentEntity require(String documentId) {
        return repository.findById(documentId)
                .orElseThrow(() -> new DocQaException(ErrorKind.NOT_FOUND, "Document " + documentId + " does not exist"));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() <= 1024 ? reason : reason.substring(0, 1021) + "...";
    }

    static DocumentSummary toSummary(DocumentEntity entity) {
        return new DocumentSummary(
                entity.getId(),
                entity.getFilename(),
                entity.getFormat(),
                entity.getSizeBytes() == null ? 0L : entity.getSizeBytes(),
                entity.getOwnerId(),
                AccessTags.normalise(entity.getAccessTags()),
                entity.getStatus(),
                entity.getIndexedAt(),
                entity.getVersion() == null ? 0 : entity.getVersion(),
                entity.getChunkCount() == null ? 0 : entity.getChunkCount(),
                entity.getFailureReason());
    }

    public record NewRun(String documentId,
                         String contentHash,
                         String filename,
                         DocumentFormat format,
                         long sizeBytes,
                         String ownerId,
                         Set<String> accessTags) {
    }
}
