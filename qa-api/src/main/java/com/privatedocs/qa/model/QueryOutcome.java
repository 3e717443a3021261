package com.privatedocs.qa.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.privatedocs.qa.service.ErrorKind;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryOutcome(Status status,
                           QueryResult result,
                           ErrorKind errorKind,
                           String message) {

    public enum Status {
        ANSWERED,
        INSUFFICIENT_EVIDENCE,
        FAILED
    }

    public static QueryOutcome answered(QueryResult result) {
        return new QueryOutcome(Status.ANSWERED, result, null, null);
    }

    public static QueryOutcome insufficientEvidence(QueryResult result) {
        return new QueryOutcome(Status.INSUFFICIENT_EVIDENCE, result, null, null);
    }

    public static QueryOutcome failed(ErrorKind errorKind, String message) {
        return new QueryOutcome(Status.FAILED, null, errorKind, message);
    }

    public boolean failed() {
        return status == Status.FAILED;
    }
}
