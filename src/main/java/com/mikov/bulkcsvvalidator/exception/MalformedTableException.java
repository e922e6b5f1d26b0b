package com.mikov.bulkcsvvalidator.exception;

/**
 * The uploaded bytes could not be read as delimited text with a header row.
 */
public class MalformedTableException extends UserInputException {

    public MalformedTableException(final String message) {
        super(message);
    }

    public MalformedTableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
