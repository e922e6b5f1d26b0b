package com.mikov.bulkcsvvalidator.services;

import com.mikov.bulkcsvvalidator.exception.JobNotFoundException;
import com.mikov.bulkcsvvalidator.exception.JobStateException;
import com.mikov.bulkcsvvalidator.exception.StorageException;
import com.mikov.bulkcsvvalidator.model.JobRecord;
import com.mikov.bulkcsvvalidator.model.JobStats;
import com.mikov.bulkcsvvalidator.model.JobStatus;
import com.mikov.bulkcsvvalidator.model.JobStatusView;
import com.mikov.bulkcsvvalidator.model.UserAccount;
import com.mikov.bulkcsvvalidator.repository.FileRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Writes job lifecycle transitions: IN_QUEUE -> VALIDATING -> COMPLETED | ERROR.
 * Nothing moves a job out of COMPLETED or ERROR.
 *
 * @author zahari.mikov
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStatusRecorder {
    static final int MAX_ERROR_LENGTH = 2000;

    private final FileRecordRepository fileRecordRepository;

    /**
     * Creates the job row in IN_QUEUE so status queries find it while it waits.
     */
    public JobRecord recordStart(final String fileId, final UserAccount user, final int totalEmails,
                                 final String objectStorageId) {
        final var record = JobRecord.builder()
            .fileId(fileId)
            .userId(user.getUserId())
            .userEmail(user.getUserEmail())
            .status(JobStatus.IN_QUEUE)
            .stats(new JobStats(totalEmails))
            .objectStorageId(objectStorageId)
            .createdAt(Instant.now())
            .build();
        try {
            fileRecordRepository.insert(record);
        } catch (final DataAccessException e) {
            throw new StorageException("Failed to record job " + fileId + ": " + e.getMessage(), e);
        }
        log.info("Job {} queued for user {} with {} emails", fileId, user.getUserId(), totalEmails);
        return record;
    }

    public void recordValidating(final String fileId) {
        final int updated;
        try {
            updated = fileRecordRepository.updateStatus(fileId, List.of(JobStatus.IN_QUEUE), JobStatus.VALIDATING);
        } catch (final DataAccessException e) {
            throw new StorageException("Failed to update job " + fileId + ": " + e.getMessage(), e);
        }
        if (updated != 1) {
            throw new JobStateException("Job " + fileId + " cannot start validating: " + describeState(fileId));
        }
        log.info("Job {} is validating", fileId);
    }

    /**
     * Marks the job COMPLETED with its final stats. Runs inside the settlement transaction,
     * so failures are left to propagate and roll the debit back.
     */
    public void recordSuccess(final String fileId, final JobStats stats, final long creditsConsumed) {
        if (fileRecordRepository.complete(fileId, stats, creditsConsumed) != 1) {
            throw new JobStateException("Job " + fileId + " cannot complete: " + describeState(fileId));
        }
        log.info("Job {} completed: {}", fileId, stats);
    }

    /**
     * Best-effort ERROR write. A failure here is logged and reported through the return value
     * so the caller can still surface the original error.
     *
     * @return whether the job row now records the error
     */
    public boolean recordFailure(final String fileId, final String errorSummary) {
        final var message = truncate(errorSummary == null ? "Unknown error" : errorSummary);
        try {
            if (fileRecordRepository.fail(fileId, message) == 1) {
                log.info("Job {} marked as failed: {}", fileId, message);
                return true;
            }
            log.warn("Job {} not marked as failed, it is {}", fileId, describeState(fileId));
        } catch (final DataAccessException e) {
            log.error("Could not record failure of job {} ({}): {}", fileId, message, e.getMessage());
        }
        return false;
    }

    public JobRecord find(final String fileId) {
        try {
            return fileRecordRepository.findById(fileId).orElseThrow(() -> new JobNotFoundException(fileId));
        } catch (final DataAccessException e) {
            throw new StorageException("Failed to fetch file status: " + e.getMessage(), e);
        }
    }

    public JobStatusView describe(final String fileId) {
        return JobStatusView.of(find(fileId));
    }

    private String describeState(final String fileId) {
        return fileRecordRepository.findById(fileId)
            .map(record -> "status is " + record.getStatus().getLabel())
            .orElse("no such job");
    }

    private static String truncate(final String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
