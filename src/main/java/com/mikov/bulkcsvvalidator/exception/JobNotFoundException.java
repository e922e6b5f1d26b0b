package com.mikov.bulkcsvvalidator.exception;

public class JobNotFoundException extends PipelineException {

    public JobNotFoundException(final String fileId) {
        super("No validation job found for file " + fileId);
    }
}
