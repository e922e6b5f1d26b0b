package com.mikov.bulkcsvvalidator.model;

/**
 * Pairs a submitted record with its outcome so results can be re-threaded by row index.
 */
public record VerifiedRecord(EmailRecord record, VerificationOutcome outcome) {

    public int sourceRowIndex() {
        return record.sourceRowIndex();
    }
}
