package com.shetka.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.shetka.error.AuthException;
import com.shetka.error.InfrastructureException;
import com.shetka.error.ValidationException;
import com.shetka.model.ApiResponses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to {@code {"ok": false, "error": ...}} bodies.
 * 401 for auth, 400 for bad input, 500 for everything else.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ApiResponses.Error> handleAuth(AuthException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ApiResponses.Error.of(ex.getMessage()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponses.Error> handleValidation(ValidationException ex) {
        log.warn("Invalid order request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponses.Error.of(ex.getMessage(), ex.getFields()));
    }

    @ExceptionHandler(JsonProcessingException.class)
    public ResponseEntity<ApiResponses.Error> handleMalformedJson(JsonProcessingException ex) {
        log.warn("Malformed request body: {}", ex.getOriginalMessage());
        return malformedJson();
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponses.Error> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return malformedJson();
    }

    private static ResponseEntity<ApiResponses.Error> malformedJson() {
        return ResponseEntity.badRequest().body(ApiResponses.Error.of("Malformed JSON"));
    }

    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ApiResponses.Error> handleInfrastructure(InfrastructureException ex) {
        log.error("Infrastructure failure: {}", ex.getMessage(), ex);
        return internalError();
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponses.Error> handleUnexpected(RuntimeException ex) {
        log.error("Unexpected error processing request", ex);
        return internalError();
    }

    private static ResponseEntity<ApiResponses.Error> internalError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponses.Error.of("Internal server error"));
    }
}
