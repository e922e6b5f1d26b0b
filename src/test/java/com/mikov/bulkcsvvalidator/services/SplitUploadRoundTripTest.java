package com.mikov.bulkcsvvalidator.services;

import com.mikov.bulkcsvvalidator.config.PipelineConfiguration;
import com.mikov.bulkcsvvalidator.config.PipelineSettings;
import com.mikov.bulkcsvvalidator.csv.CsvTableWriter;
import com.mikov.bulkcsvvalidator.csv.TabularSplitter;
import com.mikov.bulkcsvvalidator.model.CreditReservation;
import com.mikov.bulkcsvvalidator.model.JobRequest;
import com.mikov.bulkcsvvalidator.model.JobStats;
import com.mikov.bulkcsvvalidator.model.PreparedUpload;
import com.mikov.bulkcsvvalidator.model.VerificationOutcome;
import com.mikov.bulkcsvvalidator.model.VerificationStatus;
import com.mikov.bulkcsvvalidator.storage.BlobStorageService;
import com.mikov.bulkcsvvalidator.storage.FileSystemBlobStore;
import com.mikov.bulkcsvvalidator.validation.AddressPreFilter;
import com.mikov.bulkcsvvalidator.verification.ChunkScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Uploads prepared as two extracts and then validated, against a filesystem blob store.
 */
@ExtendWith(MockitoExtension.class)
class SplitUploadRoundTripTest {
    private static final String USER_EMAIL = "owner@example.com";

    @TempDir
    Path root;

    @Mock
    private CreditLedger creditLedger;

    @Mock
    private JobStatusRecorder jobStatusRecorder;

    private final TabularSplitter splitter = new TabularSplitter(PipelineSettings.getDefault());
    private BlobStorageService storage;
    private UploadPreparationService preparation;
    private ValidationPipelineService pipeline;

    @BeforeEach
    void setUp() {
        final var settings = PipelineSettings.getDefault();
        storage = new BlobStorageService(new FileSystemBlobStore(root), PipelineConfiguration.fixedRetry(1, 1),
            settings);
        preparation = new UploadPreparationService(splitter, new CsvTableWriter(), storage);
        final var scheduler = new ChunkScheduler(address -> AddressPreFilter.looksLikeEmail(address)
            ? VerificationOutcome.builder().address(address).status(VerificationStatus.VALID).label("valid").build()
            : VerificationOutcome.rejectedLocally(address, "Email fails structural check"), Runnable::run);
        pipeline = new ValidationPipelineService(creditLedger, jobStatusRecorder, storage, splitter, scheduler,
            new ResultMerger(), new CsvTableWriter(), settings);
    }

    private static byte[] csv(final String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private CreditReservation givenCredits(final long credits) {
        final var reservation = new CreditReservation("user-1", credits, 100);
        when(creditLedger.authorize(eq(USER_EMAIL), anyLong())).thenReturn(reservation);
        return reservation;
    }

    private List<List<String>> validateSplit(final PreparedUpload prepared, final int columnIndex) {
        pipeline.run(JobRequest.builder()
            .fileId("job-1")
            .filename("result.csv")
            .emailColumnIndex(columnIndex)
            .userEmail(USER_EMAIL)
            .totalEmails(prepared.totalEmails())
            .fullFilename(prepared.fullFilename())
            .emailsFilename(prepared.emailsFilename())
            .build(), ProgressListener.NONE);
        return storedRows("result.csv");
    }

    private List<List<String>> storedRows(final String filename) {
        final var table = splitter.parse(storage.download(filename));
        final var rows = new ArrayList<List<String>>();
        rows.add(table.getHeader());
        rows.addAll(table.getRows());
        return rows;
    }

    @Test
    void singleColumnUploadIsValidated() {
        givenCredits(2);
        final var prepared = preparation.prepare(csv("email\na@x.com\nb@y.com\n"), "list.csv", 0, false);

        assertThat(validateSplit(prepared, 0)).containsExactly(
            List.of("Email", "Email_Validation"),
            List.of("a@x.com", "valid"),
            List.of("b@y.com", "valid"));
        assertThat(root.resolve("uploads").resolve(prepared.fullFilename())).doesNotExist();
        assertThat(root.resolve("uploads").resolve(prepared.emailsFilename())).doesNotExist();
    }

    @Test
    void singleColumnUploadKeepsEmptyAddressRows() {
        givenCredits(1);
        final var prepared = preparation.prepare(csv("email\na@x.com\n\"\"\n"), "list.csv", 0, false);

        assertThat(validateSplit(prepared, 0)).containsExactly(
            List.of("Email", "Email_Validation"),
            List.of("a@x.com", "valid"),
            List.of("", "invalid"));
    }

    @Test
    void raggedRowStaysAlignedAcrossExtracts() {
        givenCredits(2);
        final var prepared = preparation.prepare(csv("email,name\na@x.com,A\nb@y.com\n"), "list.csv", 0, false);

        assertThat(prepared.warning()).isNotNull();
        assertThat(validateSplit(prepared, 0)).containsExactly(
            List.of("Email", "Email_Validation", "name"),
            List.of("a@x.com", "valid", "A"),
            List.of("b@y.com", "valid", ""));
    }

    @Test
    void previewCountIsAcceptedForFileWithDuplicatesAndEmptyAddresses() {
        final var reservation = givenCredits(1);
        final var content = csv("name,email\nA,a@x.com\nB,a@x.com\nC,\n");
        storage.upload("contacts.csv", content);
        final var preview = preparation.preview(content, 1);

        pipeline.run(JobRequest.builder()
            .fileId("job-1")
            .filename("contacts.csv")
            .emailColumnIndex(1)
            .userEmail(USER_EMAIL)
            .totalEmails(preview.getTotalEmails())
            .build(), ProgressListener.NONE);

        assertThat(preview.getTotalEmails()).isEqualTo(1);
        verify(creditLedger).authorize(USER_EMAIL, 1);
        verify(creditLedger).settle(reservation, "job-1", new JobStats(3, 2, 1, 0, 3));
        assertThat(storedRows("contacts.csv")).hasSize(4);
    }

    @Test
    void preparedCountMatchesPreviewCount() {
        final var content = csv("name,email\nA,a@x.com\nB,A@X.COM\nC,\nD,b@y.org\n");

        final var preview = preparation.preview(content, 1);
        final var prepared = preparation.prepare(content, "list.csv", 1, true);

        assertThat(prepared.totalEmails()).isEqualTo(preview.getTotalEmails()).isEqualTo(2);
    }
}
