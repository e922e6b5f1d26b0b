package com.mikov.bulkcsvvalidator.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a validation run: IN_QUEUE -> VALIDATING -> COMPLETED | ERROR.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {
    IN_QUEUE("In Queue"),
    VALIDATING("Validating"),
    COMPLETED("Completed"),
    ERROR("Error");

    @JsonValue
    private final String label;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
