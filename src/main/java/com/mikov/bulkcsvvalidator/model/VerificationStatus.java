package com.mikov.bulkcsvvalidator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum VerificationStatus {
    VALID("valid"),
    INVALID("invalid"),
    UNVERIFIABLE("unverifiable");

    private final String label;

    /**
     * Maps the verification service's {@code email_status} onto a terminal status.
     * Anything other than valid or invalid is inconclusive.
     */
    public static VerificationStatus fromServiceStatus(final String serviceStatus) {
        if (serviceStatus == null) {
            return UNVERIFIABLE;
        }
        final var normalized = serviceStatus.trim().toLowerCase();
        if (VALID.label.equals(normalized)) {
            return VALID;
        }
        if (INVALID.label.equals(normalized)) {
            return INVALID;
        }
        return UNVERIFIABLE;
    }
}
