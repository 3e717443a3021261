package com.privatedocs.qa.service;

import org.springframework.http.HttpStatus;

public class DocQaException extends RuntimeException {

    private final ErrorKind kind;

    public DocQaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DocQaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public HttpStatus status() {
        return kind.status();
    }
}
