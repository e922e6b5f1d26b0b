package com.mikov.bulkcsvvalidator.controller.error;

import com.mikov.bulkcsvvalidator.exception.JobNotFoundException;
import com.mikov.bulkcsvvalidator.exception.QueueFullException;
import com.mikov.bulkcsvvalidator.exception.StorageException;
import com.mikov.bulkcsvvalidator.exception.UserInputException;
import com.mikov.bulkcsvvalidator.utils.ErrorMessageTranslator;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps pipeline failures to HTTP responses.
 *
 * @author zahari.mikov
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UserInputException.class)
    public ResponseEntity<ErrorResponse> handleUserInput(final UserInputException ex, final HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "INVALID_REQUEST");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(final JobNotFoundException ex, final HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
    }

    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<ErrorResponse> handleQueueFull(final QueueFullException ex, final HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.TOO_MANY_REQUESTS, "QUEUE_FULL");
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(final StorageException ex, final HttpServletRequest request) {
        log.error("Storage failure on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR");
    }

    /**
     * Fallback for anything the pipeline did not classify.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(final Exception ex, final HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> buildResponse(final Throwable error,
                                                        final HttpServletRequest request,
                                                        final HttpStatus status,
                                                        final String errorCode) {
        final var response = ErrorResponse.of(status.value(), errorCode,
            ErrorMessageTranslator.translate(error), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
