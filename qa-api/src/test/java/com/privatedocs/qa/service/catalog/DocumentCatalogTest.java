package com.privatedocs.qa.service.catalog;

import com.privatedocs.qa.model.DocumentFormat;
import com.privatedocs.qa.model.DocumentStatus;
import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.persistence.repository.DocumentRepository;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles({"test", "template"})
class DocumentCatalogTest {

    @Autowired
    private DocumentCatalog catalog;

    @Autowired
    private DocumentRepository repository;

    @BeforeEach
    void cleanCatalog() {
        repository.deleteAll();
    }

    @Test
    void beginRunCreatesPendingVersionOneAndRerunBumpsVersion() {
        DocumentSummary first = catalog.beginRun(run("doc-1", "hash-1", "alice", Set.of(" HR ")));

        assertThat(first.status()).isEqualTo(DocumentStatus.PENDING);
        assertThat(first.version()).isEqualTo(1);
        assertThat(first.accessTags()).containsExactly("hr");

        catalog.markFailed("doc-1", "Embedding service unavailable");
        DocumentSummary second = catalog.beginRun(run("doc-1", "hash-1", "alice", Set.of("hr")));

        assertThat(second.version()).isEqualTo(2);
        assertThat(second.status()).isEqualTo(DocumentStatus.PENDING);
        assertThat(second.failureReason()).isNull();
    }

    @Test
    void markIndexedRecordsChunkCountAndTimestamp() {
        catalog.beginRun(run("doc-1", "hash-1", "alice", Set.of("hr")));

        DocumentSummary indexed = catalog.markIndexed("doc-1", 4);

        assertThat(indexed.status()).isEqualTo(DocumentStatus.INDEXED);
        assertThat(indexed.chunkCount()).isEqualTo(4);
        assertThat(indexed.indexedAt()).isNotNull();
        assertThat(catalog.findLatestByOwnerAndHash("alice", "hash-1")).get()
                .extracting(DocumentSummary::id)
                .isEqualTo("doc-1");
        assertThat(catalog.findLatestByOwnerAndHash("bob", "hash-1")).isEmpty();
    }

    @Test
    void failureReasonIsTruncated() {
        catalog.beginRun(run("doc-1", "hash-1", "alice", Set.of()));

        DocumentSummary failed = catalog.markFailed("doc-1", "x".repeat(5000));

        assertThat(failed.status()).isEqualTo(DocumentStatus.FAILED);
        assertThat(failed.failureReason()).hasSize(1024).endsWith("...");
    }

    @Test
    void indexedIdQueriesOnlyReturnIndexedDocuments() {
        catalog.beginRun(run("hr-doc", "h1", "alice", Set.of("hr")));
        catalog.markIndexed("hr-doc", 1);
        catalog.beginRun(run("eng-doc", "h2", "bob", Set.of("eng", "shared")));
        catalog.markIndexed("eng-doc", 1);
        catalog.beginRun(run("pending-doc", "h3", "alice", Set.of("hr")));

        assertThat(catalog.indexedDocumentIds()).containsExactlyInAnyOrder("hr-doc", "eng-doc");
        assertThat(catalog.indexedDocumentIdsOwnedBy("alice")).containsExactly("hr-doc");
        assertThat(catalog.indexedDocumentIdsWithAnyTag(Set.of("hr", "shared"))).containsExactlyInAnyOrder("hr-doc", "eng-doc");
        assertThat(catalog.indexedDocumentIdsWithAnyTag(Set.of())).isEmpty();
        assertThat(catalog.listIndexedWithAnyTag(Set.of("eng"))).extracting(DocumentSummary::id).containsExactly("eng-doc");
        assertThat(catalog.listOwnedBy("alice")).hasSize(2);
        assertThat(catalog.countAll()).isEqualTo(3);
        assertThat(catalog.countIndexed()).isEqualTo(2);
    }

    @Test
    void updateAccessTagsReplacesTags() {
        catalog.beginRun(run("doc-1", "hash-1", "alice", Set.of("hr")));
        catalog.markIndexed("doc-1", 1);

        catalog.updateAccessTags("doc-1", Set.of("Finance"));

        assertThat(catalog.indexedDocumentIdsWithAnyTag(Set.of("hr"))).isEmpty();
        assertThat(catalog.indexedDocumentIdsWithAnyTag(Set.of("finance"))).containsExactly("doc-1");
    }

    @Test
    void deleteAndDeleteAll() {
        catalog.beginRun(run("doc-1", "hash-1", "alice", Set.of("hr")));
        catalog.beginRun(run("doc-2", "hash-2", "alice", Set.of("hr")));

        assertThat(catalog.delete("doc-1")).isTrue();
        assertThat(catalog.delete("doc-1")).isFalse();
        assertThat(catalog.findById("doc-1")).isEmpty();
        assertThat(catalog.deleteAll()).isEqualTo(1);
        assertThat(catalog.countAll()).isZero();
    }

    @Test
    void lifecycleUpdatesOnMissingDocumentAreNotFound() {
        assertThatThrownBy(() -> catalog.markIndexed("ghost", 1))
                .isInstanceOf(DocQaException.class)
                .satisfies(error -> assertThat(((DocQaException) error).kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    private static DocumentCatalog.NewRun run(String id, String hash, String owner, Set<String> tags) {
        return new DocumentCatalog.NewRun(id, hash, id + ".txt", DocumentFormat.TXT, 100L, owner, tags);
    }
}
