package com.mikov.bulkcsvvalidator.exception;

/**
 * Base unchecked exception for failures raised by the validation pipeline.
 *
 * @author zahari.mikov
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(final String message) {
        super(message);
    }

    protected PipelineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
