package com.mikov.bulkcsvvalidator.exception;

import lombok.Getter;

/**
 * A chunk worker died outside the verification client's own error handling.
 * Fatal for the whole run: partial chunk results cannot be attributed back to rows.
 */
@Getter
public class ChunkWorkerException extends PipelineException {
    private final int chunkIndex;

    public ChunkWorkerException(final int chunkIndex, final Throwable cause) {
        super("Chunk worker " + chunkIndex + " failed: " + cause.getMessage(), cause);
        this.chunkIndex = chunkIndex;
    }
}
