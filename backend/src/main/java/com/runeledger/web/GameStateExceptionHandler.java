package com.runeledger.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GameStateExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GameStateExceptionHandler.class);

    @ExceptionHandler(GameStateException.class)
    public ResponseEntity<GameStateErrorResponse> handle(GameStateException ex) {
        if (ex.getCategory() == ErrorCategory.INVARIANT_VIOLATION) {
            log.error("Invariant violation {}: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity
                .status(ex.getCategory().getStatus())
                .body(new GameStateErrorResponse(ex.getCode(), ex.getCategory(), ex.getMessage()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<GameStateErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Rejected write that violates a datastore constraint: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new GameStateErrorResponse(
                        "DATA_INTEGRITY_VIOLATION",
                        ErrorCategory.CONSTRAINT_VIOLATION,
                        "Write rejected by a datastore constraint"
                ));
    }

    public record GameStateErrorResponse(
            String code,
            ErrorCategory category,
            String message
    ) {
    }
}
