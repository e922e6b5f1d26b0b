package com.mikov.bulkcsvvalidator.controller;

import com.mikov.bulkcsvvalidator.controller.error.GlobalExceptionHandler;
import com.mikov.bulkcsvvalidator.exception.InsufficientCreditsException;
import com.mikov.bulkcsvvalidator.exception.JobNotFoundException;
import com.mikov.bulkcsvvalidator.exception.QueueFullException;
import com.mikov.bulkcsvvalidator.exception.StorageException;
import com.mikov.bulkcsvvalidator.model.CsvPreviewStats;
import com.mikov.bulkcsvvalidator.model.JobRequest;
import com.mikov.bulkcsvvalidator.model.JobStats;
import com.mikov.bulkcsvvalidator.model.JobStatus;
import com.mikov.bulkcsvvalidator.model.JobStatusView;
import com.mikov.bulkcsvvalidator.model.PreparedUpload;
import com.mikov.bulkcsvvalidator.services.JobStatusRecorder;
import com.mikov.bulkcsvvalidator.services.UploadPreparationService;
import com.mikov.bulkcsvvalidator.services.ValidationJobQueue;
import com.mikov.bulkcsvvalidator.storage.BlobStorageService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests for the validation endpoints and their error mapping.
 */
@WebMvcTest(controllers = EmailValidatorController.class)
@Import(GlobalExceptionHandler.class)
class EmailValidatorControllerApiTests {
    private static final String VALIDATE_BODY = """
        {"emailColumnIndex": 1, "user_email": "owner@example.com", "total_emails": 3}
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ValidationJobQueue validationJobQueue;

    @MockBean
    private JobStatusRecorder jobStatusRecorder;

    @MockBean
    private UploadPreparationService uploadPreparationService;

    @MockBean
    private BlobStorageService blobStorageService;

    /**
     * Verifies that a validation request is queued and its file id returned.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void validateQueuesTheJob() throws Exception {
        BDDMockito.given(validationJobQueue.enqueue(any())).willReturn("job-1");

        mockMvc.perform(post("/email-validator/validate/contacts.csv")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALIDATE_BODY))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.file_id").value("job-1"))
            .andExpect(jsonPath("$.status").value("In Queue"))
            .andExpect(jsonPath("$.filename").value("contacts.csv"));

        final var captor = ArgumentCaptor.forClass(JobRequest.class);
        BDDMockito.then(validationJobQueue).should().enqueue(captor.capture());
        assertThat(captor.getValue().getEmailColumnIndex()).isEqualTo(1);
        assertThat(captor.getValue().getTotalEmails()).isEqualTo(3);
    }

    /**
     * Verifies that a missing column index is a client error.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void validateRequiresColumnIndex() throws Exception {
        mockMvc.perform(post("/email-validator/validate/contacts.csv")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_email\": \"owner@example.com\", \"total_emails\": 3}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_REQUEST"))
            .andExpect(jsonPath("$.message").value("Email column index is required"));
    }

    /**
     * Verifies that insufficient credits become an actionable 400 message.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void insufficientCreditsNamesTheShortfall() throws Exception {
        BDDMockito.given(validationJobQueue.enqueue(any())).willThrow(new InsufficientCreditsException(10, 4));

        mockMvc.perform(post("/email-validator/validate/contacts.csv")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALIDATE_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("need 6 more credits")));
    }

    /**
     * Verifies that a full job queue maps to HTTP 429.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void fullQueueMapsToTooManyRequests() throws Exception {
        BDDMockito.given(validationJobQueue.enqueue(any()))
            .willThrow(new QueueFullException("Too many validation jobs in progress. Please try again later.", null));

        mockMvc.perform(post("/email-validator/validate/contacts.csv")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALIDATE_BODY))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.error").value("QUEUE_FULL"));
    }

    /**
     * Verifies the status view including progress.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void statusReturnsProgress() throws Exception {
        BDDMockito.given(jobStatusRecorder.describe("job-1"))
            .willReturn(new JobStatusView(JobStatus.VALIDATING, new JobStats(4, 1, 1, 0, 2), 50, null));

        mockMvc.perform(get("/email-validator/status/job-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("Validating"))
            .andExpect(jsonPath("$.progress").value(50))
            .andExpect(jsonPath("$.stats.total_emails").value(4))
            .andExpect(jsonPath("$.stats.processed").value(2));
    }

    /**
     * Verifies that an unknown job maps to HTTP 404.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unknownJobMapsToNotFound() throws Exception {
        BDDMockito.given(jobStatusRecorder.describe("missing")).willThrow(new JobNotFoundException("missing"));

        mockMvc.perform(get("/email-validator/status/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("JOB_NOT_FOUND"));
    }

    /**
     * Verifies that the augmented CSV is served as an attachment.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void downloadServesCsv() throws Exception {
        final var body = "email,Email_Validation\r\na@x.com,valid\r\n".getBytes(StandardCharsets.UTF_8);
        BDDMockito.given(blobStorageService.download("contacts.csv")).willReturn(body);

        mockMvc.perform(get("/email-validator/download/contacts.csv"))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", "attachment; filename=\"contacts.csv\""))
            .andExpect(content().bytes(body));
    }

    /**
     * Verifies that a missing stored file is translated into readable guidance.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingStoredFileIsTranslated() throws Exception {
        BDDMockito.given(blobStorageService.download("gone.csv"))
            .willThrow(new StorageException("Failed to fetch file uploads/gone.csv: not found"));

        mockMvc.perform(get("/email-validator/download/gone.csv"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("STORAGE_ERROR"))
            .andExpect(jsonPath("$.message").value("The uploaded file could not be found. Please upload it again."));
    }

    /**
     * Verifies the preview and upload endpoints pass the multipart file through.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void previewAndUploadAcceptMultipartFiles() throws Exception {
        final var file = new MockMultipartFile("file", "list.csv", "text/csv",
            "email\na@x.com\n".getBytes(StandardCharsets.UTF_8));
        BDDMockito.given(uploadPreparationService.preview(any(), eq(0))).willReturn(CsvPreviewStats.builder()
            .totalRows(1)
            .totalEmails(1)
            .columnName("email")
            .build());
        BDDMockito.given(uploadPreparationService.prepare(any(), eq("list.csv"), anyInt(), anyBoolean()))
            .willReturn(new PreparedUpload("list_full_1.csv", "list_emails_1.csv", 1, null));

        mockMvc.perform(multipart("/email-validator/preview").file(file).param("emailColumnIndex", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalEmails").value(1))
            .andExpect(jsonPath("$.columnName").value("email"));
        mockMvc.perform(multipart("/email-validator/upload").file(file)
                .param("emailColumnIndex", "0")
                .param("removeEmptyEmails", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.emailsFilename").value("list_emails_1.csv"));
    }
}
