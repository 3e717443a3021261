package com.privatedocs.qa.controller;

import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DocQaException.class)
    public ResponseEntity<Map<String, Object>> handleDocQaException(DocQaException exception) {
        return body(exception.kind(), exception.getMessage());
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleRejectedExecution(RejectedExecutionException exception) {
        log.warn("Worker pool saturated, rejecting request: {}", exception.getMessage());
        return body(ErrorKind.RATE_LIMITED, "Server is busy, please retry later");
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(WebExchangeBindException exception) {
        String message = exception.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(ErrorKind.VALIDATION, message.isBlank() ? "Request is invalid" : message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInputException(ServerWebInputException exception) {
        return body(ErrorKind.VALIDATION, exception.getReason() == null ? "Request is invalid" : exception.getReason());
    }

    static ResponseEntity<Map<String, Object>> body(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.status())
                .body(Map.of(
                        "error", message == null ? kind.name() : message,
                        "kind", kind.name()
                ));
    }
}
