package com.privatedocs.qa.service.qa;

import com.privatedocs.qa.model.QueryOutcome;
import com.privatedocs.qa.service.access.CallerIdentity;

import java.util.List;

public interface QueryService {

    QueryOutcome ask(String question, String documentId, CallerIdentity caller);

    List<QueryOutcome> askBatch(List<String> questions, CallerIdentity caller);

    List<String> suggestions(String topic);
}
