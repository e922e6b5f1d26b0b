package com.mikov.bulkcsvvalidator.exception;

/**
 * Blob store or relational store failure. The original message is kept for the job record.
 */
public class StorageException extends PipelineException {

    public StorageException(final String message) {
        super(message);
    }

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
