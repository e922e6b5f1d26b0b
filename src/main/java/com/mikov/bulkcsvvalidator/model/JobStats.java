package com.mikov.bulkcsvvalidator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregate counters of one validation run.
 * {@code processed} only grows and equals {@code total} once every row has an outcome.
 *
 * @author zahari.mikov
 */
@Getter
@ToString
@EqualsAndHashCode
public class JobStats {

    @JsonProperty("total_emails")
    private final int total;
    private int valid;
    private int invalid;
    private int unverifiable;
    private int processed;

    public JobStats(final int total) {
        this.total = total;
    }

    public JobStats(final int total, final int valid, final int invalid, final int unverifiable, final int processed) {
        this.total = total;
        this.valid = valid;
        this.invalid = invalid;
        this.unverifiable = unverifiable;
        this.processed = processed;
    }

    public void record(final VerificationStatus status) {
        switch (status) {
            case VALID -> valid++;
            case INVALID -> invalid++;
            case UNVERIFIABLE -> unverifiable++;
        }
        processed++;
    }

    public int progressPercent() {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.min(100, (processed * 100L) / total);
    }
}
