package com.privatedocs.qa.service.retrieval;

import com.privatedocs.qa.model.RetrievedChunk;

import java.util.List;
import java.util.Set;

public interface DenseRetriever {

    List<RetrievedChunk> search(String question, Set<String> allowedDocumentIds);
}
