package com.privatedocs.qa.service.access;

import com.privatedocs.qa.model.DocumentStatus;
import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.service.catalog.DocumentCatalog;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Computes which documents a caller may retrieve from. Evaluated against the catalog on every request; nothing is cached.
 */
@Component
public class AccessControlFilter {

    private final DocumentCatalog catalog;

    public AccessControlFilter(DocumentCatalog catalog) {
        this.catalog = catalog;
    }

    public Set<String> allowedDocumentIds(CallerIdentity caller) {
        if (caller.admin()) {
            return Set.copyOf(catalog.indexedDocumentIds());
        }
        Set<String> allowed = new HashSet<>(catalog.indexedDocumentIdsOwnedBy(caller.callerId()));
        allowed.addAll(catalog.indexedDocumentIdsWithAnyTag(caller.grantedTags()));
        return Collections.unmodifiableSet(allowed);
    }

    public boolean canRead(CallerIdentity caller, DocumentSummary document) {
        if (document.status() != DocumentStatus.INDEXED) {
            return false;
        }
        return caller.admin()
                || caller.callerId().equals(document.ownerId())
                || !Collections.disjoint(caller.grantedTags(), document.accessTags());
    }

    public boolean canManage(CallerIdentity caller, DocumentSummary document) {
        return caller.admin() || caller.callerId().equals(document.ownerId());
    }
}
