package com.mikov.bulkcsvvalidator.model;

/**
 * One address submitted for verification.
 *
 * @param address the candidate address, trimmed
 * @param sourceRowIndex ordinal of the data row (header excluded) the address came from
 */
public record EmailRecord(String address, int sourceRowIndex) {
}
