package com.mikov.bulkcsvvalidator.storage;

import com.mikov.bulkcsvvalidator.config.PipelineSettings;
import com.mikov.bulkcsvvalidator.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Reads and writes CSV objects under the uploads prefix. Uploads are retried with a fixed backoff.
 *
 * @author zahari.mikov
 */
@Slf4j
@Service
public class BlobStorageService {
    public static final String CSV_CONTENT_TYPE = "text/csv";

    private final BlobStore blobStore;
    private final RetryTemplate uploadRetryTemplate;
    private final PipelineSettings settings;

    public BlobStorageService(final BlobStore blobStore,
                              @Qualifier("uploadRetryTemplate") final RetryTemplate uploadRetryTemplate,
                              final PipelineSettings settings) {
        this.blobStore = blobStore;
        this.uploadRetryTemplate = uploadRetryTemplate;
        this.settings = settings;
    }

    public byte[] download(final String filename) {
        final var path = settings.uploadPath(filename);
        try {
            return blobStore.get(path);
        } catch (final NoSuchFileException e) {
            throw new StorageException("Failed to fetch file " + path + ": not found", e);
        } catch (final IOException e) {
            throw new StorageException("Failed to fetch file " + path + ": " + e.getMessage(), e);
        }
    }

    public void upload(final String filename, final byte[] content) {
        final var path = settings.uploadPath(filename);
        try {
            uploadRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying upload of {} (attempt {})", path, context.getRetryCount() + 1);
                }
                blobStore.put(path, content, CSV_CONTENT_TYPE);
                return null;
            });
        } catch (final IOException e) {
            throw new StorageException("Failed to upload file " + path + " after "
                + settings.getUploadMaxAttempts() + " attempts: " + e.getMessage(), e);
        }
        log.info("Uploaded {} ({} bytes)", path, content.length);
    }

    /**
     * Best-effort removal of temporary extracts; failures are logged, not thrown.
     */
    public void deleteQuietly(final String... filenames) {
        final var paths = Arrays.stream(filenames)
            .map(settings::uploadPath)
            .collect(Collectors.toList());
        try {
            blobStore.delete(paths);
        } catch (final IOException | RuntimeException e) {
            log.warn("Could not remove {}: {}", paths, e.getMessage());
        }
    }
}
