package com.adlanda.channelknowledge.controller;

import com.adlanda.channelknowledge.exception.EmbeddingException;
import com.adlanda.channelknowledge.exception.IndexUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps pipeline failures onto HTTP responses with a small JSON error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IndexUnavailableException.class)
    public ResponseEntity<Map<String, Object>> indexUnavailable(IndexUnavailableException e) {
        log.error("Query failed, vector index unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "index_unavailable", "Knowledge index is temporarily unavailable");
    }

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<Map<String, Object>> embeddingFailed(EmbeddingException e) {
        log.error("Query failed, embedding provider error: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "embedding_unavailable", "Embedding provider is temporarily unavailable");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", details);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", status.value(),
                "error", code,
                "message", message
        ));
    }
}
