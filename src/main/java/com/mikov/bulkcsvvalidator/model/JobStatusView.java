package com.mikov.bulkcsvvalidator.model;

/**
 * What a status query returns for a file.
 */
public record JobStatusView(JobStatus status, JobStats stats, int progress, String error) {

    public static JobStatusView of(final JobRecord record) {
        final var stats = record.getStats();
        final int progress;
        if (record.getStatus() == JobStatus.COMPLETED) {
            progress = 100;
        } else {
            progress = stats == null ? 0 : stats.progressPercent();
        }
        return new JobStatusView(record.getStatus(), stats, progress, record.getErrorMessage());
    }
}
