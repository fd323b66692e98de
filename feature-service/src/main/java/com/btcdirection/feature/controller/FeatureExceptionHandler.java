package com.btcdirection.feature.controller;

import com.btcdirection.common.exception.MissingUpstreamDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice(assignableTypes = FeatureController.class)
public class FeatureExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(FeatureExceptionHandler.class);

    @ExceptionHandler(MissingUpstreamDataException.class)
    public ResponseEntity<Map<String, Object>> handleMissingData(
            MissingUpstreamDataException exception, ServerWebExchange exchange) {
        return buildResponse(HttpStatus.NOT_FOUND, exception.getMessage(), exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(
            IllegalArgumentException exception, ServerWebExchange exchange) {
        return buildResponse(HttpStatus.BAD_REQUEST, exception.getMessage(), exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(
            ResponseStatusException exception, ServerWebExchange exchange) {
        return buildResponse(HttpStatus.valueOf(exception.getStatusCode().value()), exception.getReason(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception exception, ServerWebExchange exchange) {
        log.error("Unhandled feature-service error. path={}", exchange.getRequest().getPath(), exception);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error while assembling features.", exchange);
    }

    private ResponseEntity<Map<String, Object>> buildResponse(HttpStatus status, String message,
                                                              ServerWebExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("path", exchange.getRequest().getPath().value());
        return ResponseEntity.status(status).body(body);
    }
}
