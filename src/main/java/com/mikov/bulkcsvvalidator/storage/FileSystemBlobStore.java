package com.mikov.bulkcsvvalidator.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;

/**
 * Blob store backed by a directory; object paths map to files below the root.
 */
@Slf4j
public final class FileSystemBlobStore implements BlobStore {
    private final Path root;

    public FileSystemBlobStore(final Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public byte[] get(final String path) throws IOException {
        return Files.readAllBytes(resolve(path));
    }

    @Override
    public void put(final String path, final byte[] content, final String contentType) throws IOException {
        final var target = resolve(path);
        Files.createDirectories(target.getParent());
        final var temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Stored {} ({} bytes, {})", path, content.length, contentType);
    }

    @Override
    public void delete(final Collection<String> paths) throws IOException {
        for (final var path : paths) {
            Files.deleteIfExists(resolve(path));
        }
    }

    private Path resolve(final String path) {
        final var resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Blob path escapes the storage root: " + path);
        }
        return resolved;
    }
}
