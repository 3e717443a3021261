package com.privatedocs.qa.model;

import java.util.List;

public record QueryResult(String answer,
                          List<Citation> citations,
                          double confidence,
                          boolean insufficientEvidence,
                          QuestionType questionType) {

    public static final String INSUFFICIENT_EVIDENCE_ANSWER =
            "I could not find enough evidence in the documents available to you to answer this question.";

    public static QueryResult insufficientEvidence(QuestionType questionType) {
        return new QueryResult(INSUFFICIENT_EVIDENCE_ANSWER, List.of(), 0.0, true, questionType);
    }
}
