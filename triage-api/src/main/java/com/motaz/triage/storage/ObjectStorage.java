package com.motaz.triage.storage;

import java.io.IOException;

/** Blob store for uploaded dataset files. */
public interface ObjectStorage {

    /**
     * Stores the content under the given key.
     *
     * @return the location to pass to {@link #get(String)}
     */
    String put(String key, byte[] content) throws IOException;

    byte[] get(String location) throws IOException;
}
