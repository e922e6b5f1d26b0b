package com.mikov.bulkcsvvalidator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Payload delivered by the job queue to the pipeline.
 * When both extract filenames are present the run re-joins a previously split upload.
 *
 * @author zahari.mikov
 */
@Getter
@Builder
@ToString
public class JobRequest {
    private final String fileId;
    private final String filename;
    private final int emailColumnIndex;
    private final String userEmail;
    private final int totalEmails;
    private final String fullFilename;
    private final String emailsFilename;

    public boolean isSplitUpload() {
        return fullFilename != null && !fullFilename.isBlank()
            && emailsFilename != null && !emailsFilename.isBlank();
    }
}
