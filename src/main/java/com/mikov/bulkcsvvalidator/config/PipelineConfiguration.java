package com.mikov.bulkcsvvalidator.config;

import com.mikov.bulkcsvvalidator.storage.BlobStore;
import com.mikov.bulkcsvvalidator.storage.FileSystemBlobStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Wires the pipeline collaborators: settings, HTTP client, retry policies and worker pools.
 *
 * @author zahari.mikov
 */
@Configuration
public class PipelineConfiguration {

    @Value("${pipeline.worker-count:4}")
    private int workerCount;

    @Value("${pipeline.concurrent-jobs:4}")
    private int concurrentJobs;

    @Value("${pipeline.queue-capacity:50}")
    private int queueCapacity;

    @Value("${pipeline.bucket:csv-files}")
    private String bucket;

    @Value("${pipeline.storage-root:${java.io.tmpdir}}")
    private String storageRoot;

    @Value("${pipeline.verification.base-url}")
    private String verificationBaseUrl;

    @Value("${pipeline.verification.timeout-ms:10000}")
    private int verificationTimeoutMs;

    @Value("${pipeline.verification.max-attempts:3}")
    private int verificationMaxAttempts;

    @Value("${pipeline.verification.initial-backoff-ms:1000}")
    private long verificationInitialBackoffMs;

    @Value("${pipeline.verification.max-backoff-ms:5000}")
    private long verificationMaxBackoffMs;

    @Value("${pipeline.upload.max-attempts:3}")
    private int uploadMaxAttempts;

    @Value("${pipeline.upload.backoff-ms:2000}")
    private long uploadBackoffMs;

    @Value("${pipeline.column-sample-size:10}")
    private int columnSampleSize;

    @Bean
    public PipelineSettings pipelineSettings() {
        return PipelineSettings.builder()
            .workerCount(workerCount)
            .concurrentJobs(concurrentJobs)
            .queueCapacity(queueCapacity)
            .bucket(bucket)
            .storageRoot(storageRoot)
            .verificationBaseUrl(verificationBaseUrl)
            .verificationTimeoutMs(verificationTimeoutMs)
            .verificationMaxAttempts(verificationMaxAttempts)
            .verificationInitialBackoffMs(verificationInitialBackoffMs)
            .verificationMaxBackoffMs(verificationMaxBackoffMs)
            .uploadMaxAttempts(uploadMaxAttempts)
            .uploadBackoffMs(uploadBackoffMs)
            .columnSampleSize(columnSampleSize)
            .build();
    }

    @Bean
    public RestTemplate verificationRestTemplate(final RestTemplateBuilder builder, final PipelineSettings settings) {
        final var timeout = Duration.ofMillis(settings.getVerificationTimeoutMs());
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build();
    }

    /**
     * Exponential backoff between verification attempts: 1s, 2s, 4s ... capped at the max backoff.
     */
    @Bean
    public RetryTemplate verificationRetryTemplate(final PipelineSettings settings) {
        return exponentialRetry(settings.getVerificationMaxAttempts(),
            settings.getVerificationInitialBackoffMs(), settings.getVerificationMaxBackoffMs());
    }

    @Bean
    public RetryTemplate uploadRetryTemplate(final PipelineSettings settings) {
        return fixedRetry(settings.getUploadMaxAttempts(), settings.getUploadBackoffMs());
    }

    @Bean
    public ThreadPoolTaskExecutor chunkWorkerExecutor(final PipelineSettings settings) {
        final var poolSize = settings.getWorkerCount() * settings.getConcurrentJobs();
        final var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("chunk-worker-");
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor validationJobExecutor(final PipelineSettings settings) {
        final var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getConcurrentJobs());
        executor.setMaxPoolSize(settings.getConcurrentJobs());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("validation-job-");
        return executor;
    }

    @Bean
    public BlobStore blobStore(final PipelineSettings settings) {
        return new FileSystemBlobStore(Paths.get(settings.getStorageRoot(), settings.getBucket()));
    }

    public static RetryTemplate exponentialRetry(final int maxAttempts, final long initialBackoffMs,
                                                 final long maxBackoffMs) {
        return RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
            .retryOn(RestClientException.class)
            .build();
    }

    public static RetryTemplate fixedRetry(final int maxAttempts, final long backoffMs) {
        return RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .fixedBackoff(backoffMs)
            .retryOn(IOException.class)
            .build();
    }
}
