package com.privatedocs.qa.service;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_FORMAT(HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    EXTRACTION(HttpStatus.UNPROCESSABLE_ENTITY),
    EMBEDDING_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    SYNTHESIS_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
