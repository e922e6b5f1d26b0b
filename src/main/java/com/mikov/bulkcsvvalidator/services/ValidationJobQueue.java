package com.mikov.bulkcsvvalidator.services;

import com.mikov.bulkcsvvalidator.config.PipelineSettings;
import com.mikov.bulkcsvvalidator.exception.InvalidJobRequestException;
import com.mikov.bulkcsvvalidator.exception.QueueFullException;
import com.mikov.bulkcsvvalidator.model.JobRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Accepts validation jobs, records them as queued and runs them on the bounded job executor.
 *
 * @author zahari.mikov
 */
@Slf4j
@Service
public class ValidationJobQueue {
    private static final Pattern SAFE_FILENAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    private final ValidationPipelineService pipelineService;
    private final CreditLedger creditLedger;
    private final JobStatusRecorder jobStatusRecorder;
    private final TaskExecutor executor;
    private final PipelineSettings settings;

    public ValidationJobQueue(final ValidationPipelineService pipelineService,
                              final CreditLedger creditLedger,
                              final JobStatusRecorder jobStatusRecorder,
                              @Qualifier("validationJobExecutor") final TaskExecutor executor,
                              final PipelineSettings settings) {
        this.pipelineService = pipelineService;
        this.creditLedger = creditLedger;
        this.jobStatusRecorder = jobStatusRecorder;
        this.executor = executor;
        this.settings = settings;
    }

    /**
     * Queues a run and returns its file id. The request's own file id is ignored.
     */
    public String enqueue(final JobRequest request) {
        checkRequest(request);
        final var user = creditLedger.findUser(request.getUserEmail());
        final var fileId = UUID.randomUUID().toString();
        final var job = JobRequest.builder()
            .fileId(fileId)
            .filename(request.getFilename())
            .emailColumnIndex(request.getEmailColumnIndex())
            .userEmail(request.getUserEmail())
            .totalEmails(request.getTotalEmails())
            .fullFilename(request.getFullFilename())
            .emailsFilename(request.getEmailsFilename())
            .build();

        jobStatusRecorder.recordStart(fileId, user, request.getTotalEmails(), settings.uploadPath(request.getFilename()));
        try {
            executor.execute(() -> runQueued(job));
        } catch (final TaskRejectedException e) {
            jobStatusRecorder.recordFailure(fileId, "Validation queue is full");
            throw new QueueFullException("Too many validation jobs in progress. Please try again later.", e);
        }
        return fileId;
    }

    private void runQueued(final JobRequest job) {
        try {
            pipelineService.run(job, percent -> log.info("Job {} progress {}%", job.getFileId(), percent));
        } catch (final RuntimeException e) {
            // already recorded as ERROR by the pipeline
            log.error("Job {} failed: {}", job.getFileId(), e.getMessage());
        }
    }

    private static void checkRequest(final JobRequest request) {
        if (request.getUserEmail() == null || request.getUserEmail().isBlank()) {
            throw new InvalidJobRequestException("User email and total emails are required");
        }
        if (request.getTotalEmails() < 0) {
            throw new InvalidJobRequestException("Total emails cannot be negative");
        }
        if (request.getEmailColumnIndex() < 0) {
            throw new InvalidJobRequestException("Invalid email column index");
        }
        checkFilename(request.getFilename());
        if (request.getFullFilename() != null || request.getEmailsFilename() != null) {
            if (!request.isSplitUpload()) {
                throw new InvalidJobRequestException("Both full_filename and emails_filename are required for a split upload");
            }
            checkFilename(request.getFullFilename());
            checkFilename(request.getEmailsFilename());
        }
    }

    private static void checkFilename(final String filename) {
        if (filename == null || !SAFE_FILENAME.matcher(filename).matches()) {
            throw new InvalidJobRequestException("Invalid filename: " + filename);
        }
    }
}
