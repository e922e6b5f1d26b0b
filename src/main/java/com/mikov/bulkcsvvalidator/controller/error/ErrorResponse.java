package com.mikov.bulkcsvvalidator.controller.error;

import java.time.Instant;

/**
 * Error envelope returned by every endpoint.
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path) {

    public static ErrorResponse of(final int status, final String error, final String message, final String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
