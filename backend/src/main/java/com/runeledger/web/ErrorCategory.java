package com.runeledger.web;

import org.springframework.http.HttpStatus;

public enum ErrorCategory {
    VALIDATION(HttpStatus.BAD_REQUEST),
    CONSTRAINT_VIOLATION(HttpStatus.CONFLICT),
    INSUFFICIENT_RESOURCE(HttpStatus.UNPROCESSABLE_ENTITY),
    INVARIANT_VIOLATION(HttpStatus.INTERNAL_SERVER_ERROR),
    CONCURRENCY_CONFLICT(HttpStatus.SERVICE_UNAVAILABLE),
    NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus status;

    ErrorCategory(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
