package com.privatedocs.qa.service.access;

import com.privatedocs.qa.model.DocumentFormat;
import com.privatedocs.qa.model.DocumentStatus;
import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.service.catalog.DocumentCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccessControlFilterTest {

    @Mock
    private DocumentCatalog catalog;

    @InjectMocks
    private AccessControlFilter filter;

    @Test
    void userSeesOwnedAndTagMatchedDocuments() {
        when(catalog.indexedDocumentIdsOwnedBy("alice")).thenReturn(List.of("d1"));
        when(catalog.indexedDocumentIdsWithAnyTag(Set.of("hr"))).thenReturn(List.of("d2", "d1"));

        Set<String> allowed = filter.allowedDocumentIds(CallerIdentity.user("alice", Set.of(" HR ")));

        assertThat(allowed).containsExactlyInAnyOrder("d1", "d2");
    }

    @Test
    void adminSeesEveryIndexedDocument() {
        when(catalog.indexedDocumentIds()).thenReturn(List.of("d1", "d2", "d3"));

        Set<String> allowed = filter.allowedDocumentIds(CallerIdentity.admin("root"));

        assertThat(allowed).containsExactlyInAnyOrder("d1", "d2", "d3");
        verify(catalog).indexedDocumentIds();
        verifyNoMoreInteractions(catalog);
    }

    @Test
    void userWithoutTagsOrDocumentsSeesNothing() {
        when(catalog.indexedDocumentIdsOwnedBy("bob")).thenReturn(List.of());
        when(catalog.indexedDocumentIdsWithAnyTag(any())).thenReturn(List.of());

        assertThat(filter.allowedDocumentIds(CallerIdentity.user("bob", Set.of()))).isEmpty();
    }

    @Test
    void canReadRequiresIndexedAndOwnershipOrSharedTag() {
        DocumentSummary indexed = summary("alice", Set.of("hr"), DocumentStatus.INDEXED);
        DocumentSummary pending = summary("alice", Set.of("hr"), DocumentStatus.PENDING);

        assertThat(filter.canRead(CallerIdentity.user("alice", Set.of()), indexed)).isTrue();
        assertThat(filter.canRead(CallerIdentity.user("carol", Set.of("hr")), indexed)).isTrue();
        assertThat(filter.canRead(CallerIdentity.user("dave", Set.of("eng")), indexed)).isFalse();
        assertThat(filter.canRead(CallerIdentity.admin("root"), indexed)).isTrue();
        assertThat(filter.canRead(CallerIdentity.user("alice", Set.of()), pending)).isFalse();
        assertThat(filter.canRead(CallerIdentity.admin("root"), pending)).isFalse();
    }

    @Test
    void canManageIsLimitedToOwnerAndAdmin() {
        DocumentSummary document = summary("alice", Set.of("hr"), DocumentStatus.FAILED);

        assertThat(filter.canManage(CallerIdentity.user("alice", Set.of()), document)).isTrue();
        assertThat(filter.canManage(CallerIdentity.admin("root"), document)).isTrue();
        assertThat(filter.canManage(CallerIdentity.user("carol", Set.of("hr")), document)).isFalse();
    }

    private static DocumentSummary summary(String owner, Set<String> tags, DocumentStatus status) {
        return new DocumentSummary("doc-1", "policy.txt", DocumentFormat.TXT, 42L, owner, tags, status,
                status == DocumentStatus.INDEXED ? OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC) : null, 1, 1, null);
    }
}
