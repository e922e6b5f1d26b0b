package com.mikov.bulkcsvvalidator.controller;

import com.mikov.bulkcsvvalidator.dtos.ValidateEmailsRequest;
import com.mikov.bulkcsvvalidator.dtos.ValidateEmailsResponse;
import com.mikov.bulkcsvvalidator.exception.InvalidJobRequestException;
import com.mikov.bulkcsvvalidator.exception.StorageException;
import com.mikov.bulkcsvvalidator.model.CsvPreviewStats;
import com.mikov.bulkcsvvalidator.model.JobRequest;
import com.mikov.bulkcsvvalidator.model.JobStatus;
import com.mikov.bulkcsvvalidator.model.JobStatusView;
import com.mikov.bulkcsvvalidator.model.PreparedUpload;
import com.mikov.bulkcsvvalidator.services.JobStatusRecorder;
import com.mikov.bulkcsvvalidator.services.UploadPreparationService;
import com.mikov.bulkcsvvalidator.services.ValidationJobQueue;
import com.mikov.bulkcsvvalidator.storage.BlobStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * REST controller for bulk CSV validation
 *
 * @author zahari.mikov
 */
@Slf4j
@RestController
@RequestMapping("/email-validator")
@RequiredArgsConstructor
public class EmailValidatorController {

    private final ValidationJobQueue validationJobQueue;
    private final JobStatusRecorder jobStatusRecorder;
    private final UploadPreparationService uploadPreparationService;
    private final BlobStorageService blobStorageService;

    @PostMapping(value = "/validate/{filename}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidateEmailsResponse> validate(@PathVariable final String filename,
                                                           @RequestBody final ValidateEmailsRequest body) {
        if (body == null || body.emailColumnIndex() == null) {
            throw new InvalidJobRequestException("Email column index is required");
        }
        if (body.userEmail() == null || body.totalEmails() == null) {
            throw new InvalidJobRequestException("User email and total emails are required");
        }

        final var fileId = validationJobQueue.enqueue(JobRequest.builder()
            .filename(filename)
            .emailColumnIndex(body.emailColumnIndex())
            .userEmail(body.userEmail())
            .totalEmails(body.totalEmails())
            .fullFilename(body.fullFilename())
            .emailsFilename(body.emailsFilename())
            .build());
        log.info("Queued validation of {} as job {}", filename, fileId);

        return ResponseEntity.accepted().body(new ValidateEmailsResponse(true,
            "Validation queued", fileId, JobStatus.IN_QUEUE.getLabel(), filename));
    }

    @GetMapping("/status/{fileId}")
    public ResponseEntity<JobStatusView> status(@PathVariable final String fileId) {
        return ResponseEntity.ok(jobStatusRecorder.describe(fileId));
    }

    @GetMapping("/download/{filename}")
    public ResponseEntity<byte[]> download(@PathVariable final String filename) {
        final var content = blobStorageService.download(filename);
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(BlobStorageService.CSV_CONTENT_TYPE))
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
            .body(content);
    }

    @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CsvPreviewStats> preview(@RequestParam("file") final MultipartFile file,
                                                   @RequestParam("emailColumnIndex") final int emailColumnIndex) {
        return ResponseEntity.ok(uploadPreparationService.preview(read(file), emailColumnIndex));
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PreparedUpload> upload(@RequestParam("file") final MultipartFile file,
                                                 @RequestParam("emailColumnIndex") final int emailColumnIndex,
                                                 @RequestParam(value = "removeEmptyEmails", defaultValue = "false")
                                                 final boolean removeEmptyEmails) {
        return ResponseEntity.ok(uploadPreparationService.prepare(read(file), file.getOriginalFilename(),
            emailColumnIndex, removeEmptyEmails));
    }

    private static byte[] read(final MultipartFile file) {
        try {
            return file.getBytes();
        } catch (final IOException e) {
            throw new StorageException("Failed to read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
