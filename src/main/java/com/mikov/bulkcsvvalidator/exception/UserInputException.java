package com.mikov.bulkcsvvalidator.exception;

/**
 * Problems with what the caller asked for. Surfaced verbatim and never retried.
 */
public abstract class UserInputException extends PipelineException {

    protected UserInputException(final String message) {
        super(message);
    }

    protected UserInputException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
