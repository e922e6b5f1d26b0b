package com.mikov.bulkcsvvalidator.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Durable record of one validation run, as stored in the {@code files} table.
 *
 * @author zahari.mikov
 */
@Data
@Builder
public class JobRecord {
    private final String fileId;
    private final String userId;
    private final String userEmail;
    private final JobStatus status;
    private final JobStats stats;
    private final long creditsConsumed;
    private final String errorMessage;
    private final String objectStorageId;
    private final Instant createdAt;
    private final Instant updatedAt;
}
