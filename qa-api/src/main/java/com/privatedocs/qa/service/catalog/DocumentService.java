package com.privatedocs.qa.service.catalog;

import com.privatedocs.qa.model.DocumentSummary;
import com.privatedocs.qa.model.IndexStats;
import com.privatedocs.qa.service.access.CallerIdentity;

import java.util.List;
import java.util.Set;

public interface DocumentService {

    List<DocumentSummary> listDocuments(CallerIdentity caller);

    void deleteDocument(String documentId, CallerIdentity caller);

    DocumentSummary updateAccessTags(String documentId, Set<String> accessTags, CallerIdentity caller);

    IndexStats getStats();

    long clearIndex(CallerIdentity caller);
}
