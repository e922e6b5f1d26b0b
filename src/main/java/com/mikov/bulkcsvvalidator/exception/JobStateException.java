package com.mikov.bulkcsvvalidator.exception;

public class JobStateException extends PipelineException {

    public JobStateException(final String message) {
        super(message);
    }
}
