package com.shieldsync.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error response body: error (code), message, timestamp (ISO 8601), and for pool errors the figures behind
 * them (needed/available funds, job id, ...). {@code details} is omitted when empty.
 */
public record ErrorBody(
        String error,
        String message,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> details,
        Instant timestamp
) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Map.of(), Instant.now());
    }

    public static ErrorBody of(String error, String message, Map<String, Object> details) {
        return new ErrorBody(error, message, details, Instant.now());
    }
}
