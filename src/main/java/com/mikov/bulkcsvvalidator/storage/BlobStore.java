package com.mikov.bulkcsvvalidator.storage;

import java.io.IOException;
import java.util.Collection;

/**
 * Object storage holding uploaded tables and their augmented results.
 *
 * @author zahari.mikov
 */
public interface BlobStore {

    byte[] get(final String path) throws IOException;

    void put(final String path, final byte[] content, final String contentType) throws IOException;

    /**
     * Removes the given objects. Missing objects are ignored.
     */
    void delete(final Collection<String> paths) throws IOException;
}
