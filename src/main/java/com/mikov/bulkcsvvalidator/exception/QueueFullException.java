package com.mikov.bulkcsvvalidator.exception;

public class QueueFullException extends PipelineException {

    public QueueFullException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
