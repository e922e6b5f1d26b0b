package com.mikov.bulkcsvvalidator.config;

import lombok.Builder;
import lombok.Getter;

/**
 * Immutable tuning values for the validation pipeline.
 *
 * @author zahari.mikov
 */
@Getter
@Builder
public class PipelineSettings {
    public static final String UPLOADS_PREFIX = "uploads/";

    private final int workerCount;
    private final int concurrentJobs;
    private final int queueCapacity;
    private final String bucket;
    private final String storageRoot;
    private final String verificationBaseUrl;
    private final int verificationTimeoutMs;
    private final int verificationMaxAttempts;
    private final long verificationInitialBackoffMs;
    private final long verificationMaxBackoffMs;
    private final int uploadMaxAttempts;
    private final long uploadBackoffMs;
    private final int columnSampleSize;

    public String uploadPath(final String filename) {
        return UPLOADS_PREFIX + filename;
    }

    public static PipelineSettings getDefault() {
        return PipelineSettings.builder()
            .workerCount(4)
            .concurrentJobs(4)
            .queueCapacity(50)
            .bucket("csv-files")
            .storageRoot(System.getProperty("java.io.tmpdir"))
            .verificationBaseUrl("https://readytosend-api-production.up.railway.app/verify-email")
            .verificationTimeoutMs(10000)
            .verificationMaxAttempts(3)
            .verificationInitialBackoffMs(1000)
            .verificationMaxBackoffMs(5000)
            .uploadMaxAttempts(3)
            .uploadBackoffMs(2000)
            .columnSampleSize(10)
            .build();
    }
}
