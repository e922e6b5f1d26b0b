package com.mikov.bulkcsvvalidator.services;

import com.mikov.bulkcsvvalidator.config.PipelineSettings;
import com.mikov.bulkcsvvalidator.csv.CsvTableWriter;
import com.mikov.bulkcsvvalidator.csv.TabularSplitter;
import com.mikov.bulkcsvvalidator.exception.InvalidColumnException;
import com.mikov.bulkcsvvalidator.exception.InvalidJobRequestException;
import com.mikov.bulkcsvvalidator.exception.StorageException;
import com.mikov.bulkcsvvalidator.model.CreditReservation;
import com.mikov.bulkcsvvalidator.model.EmailRecord;
import com.mikov.bulkcsvvalidator.model.JobRequest;
import com.mikov.bulkcsvvalidator.model.JobResult;
import com.mikov.bulkcsvvalidator.model.JobStatus;
import com.mikov.bulkcsvvalidator.model.MergeMode;
import com.mikov.bulkcsvvalidator.storage.BlobStorageService;
import com.mikov.bulkcsvvalidator.verification.ChunkScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one validation job end to end: authorize credits, load the table, verify every address
 * over the chunk workers, merge results back into the rows, store the augmented file and settle.
 *
 * @author zahari.mikov
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationPipelineService {

    private final CreditLedger creditLedger;
    private final JobStatusRecorder jobStatusRecorder;
    private final BlobStorageService blobStorageService;
    private final TabularSplitter tabularSplitter;
    private final ChunkScheduler chunkScheduler;
    private final ResultMerger resultMerger;
    private final CsvTableWriter csvTableWriter;
    private final PipelineSettings settings;

    public JobResult run(final JobRequest request, final ProgressListener progress) {
        final var fileId = request.getFileId();
        log.info("Starting validation of {} for {} (job {})", request.getFilename(), request.getUserEmail(), fileId);
        progress.report(0);

        CreditReservation reservation = null;
        var settled = false;
        try {
            reservation = creditLedger.authorize(request.getUserEmail(), request.getTotalEmails());
            jobStatusRecorder.recordValidating(fileId);

            final var input = request.isSplitUpload() ? loadSplitUpload(request) : loadSingleFile(request);
            final var chargeable = TabularSplitter.countChargeableAddresses(input.records());
            if (chargeable > request.getTotalEmails()) {
                throw new InvalidJobRequestException("File contains " + chargeable
                    + " emails but the job declared " + request.getTotalEmails());
            }

            final var verified = chunkScheduler.schedule(input.records(), settings.getWorkerCount());
            final var merged = resultMerger.merge(input.header(), input.rows(), verified,
                request.getEmailColumnIndex(), input.mode());

            blobStorageService.upload(request.getFilename(), csvTableWriter.write(merged.header(), merged.rows()));
            creditLedger.settle(reservation, fileId, merged.stats());
            settled = true;

            if (request.isSplitUpload()) {
                blobStorageService.deleteQuietly(request.getFullFilename(), request.getEmailsFilename());
            }
            progress.report(100);
            log.info("Validation of {} finished: {}", request.getFilename(), merged.stats());
            return new JobResult("Validation completed successfully", JobStatus.COMPLETED.getLabel());
        } catch (final RuntimeException e) {
            log.error("Validation of {} failed (job {}): {}", request.getFilename(), fileId, e.getMessage());
            if (reservation != null && !settled) {
                creditLedger.release(reservation);
            }
            jobStatusRecorder.recordFailure(fileId, e.getMessage());
            throw e;
        }
    }

    /**
     * The stored file still holds the address column; the status goes right after it.
     */
    private PipelineInput loadSingleFile(final JobRequest request) {
        final var table = tabularSplitter.parse(blobStorageService.download(request.getFilename()));
        tabularSplitter.locateAddressColumn(table, request.getEmailColumnIndex());
        final var records = tabularSplitter.extractRecords(table, request.getEmailColumnIndex());
        return new PipelineInput(table.getHeader(), table.getRows(), records, MergeMode.ANNOTATE_IN_PLACE);
    }

    /**
     * The upload was split earlier into an address extract and a residual extract.
     */
    private PipelineInput loadSplitUpload(final JobRequest request) {
        final var emails = tabularSplitter.parseExtract(blobStorageService.download(request.getEmailsFilename()));
        final var full = tabularSplitter.parseExtract(blobStorageService.download(request.getFullFilename()));
        if (emails.rowCount() != full.rowCount()) {
            throw new StorageException("Stored extracts are out of alignment: " + emails.rowCount()
                + " emails for " + full.rowCount() + " rows");
        }
        if (request.getEmailColumnIndex() > full.fieldCount()) {
            throw InvalidColumnException.outOfBounds(request.getEmailColumnIndex(), full.fieldCount() + 1);
        }
        final var records = tabularSplitter.extractRecords(emails, 0);
        return new PipelineInput(full.getHeader(), full.getRows(), records, MergeMode.REJOIN_EXTRACTED);
    }

    private record PipelineInput(List<String> header, List<List<String>> rows, List<EmailRecord> records,
                                 MergeMode mode) {
    }
}
