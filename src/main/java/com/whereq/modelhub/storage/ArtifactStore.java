package com.whereq.modelhub.storage;

import java.io.IOException;

/**
 * Byte-addressable store for model artifacts
 */
public interface ArtifactStore {

    /**
     * Read the artifact at a path
     *
     * @param path store-relative path
     * @return artifact bytes
     * @throws IOException if the artifact is missing or unreadable
     */
    byte[] load(String path) throws IOException;

    /**
     * Write an artifact, replacing any previous content
     *
     * @param path store-relative path
     * @param data artifact bytes
     * @throws IOException if the artifact cannot be written
     */
    void save(String path, byte[] data) throws IOException;

    boolean exists(String path);

    /**
     * Remove an artifact
     *
     * @return true if something was deleted
     */
    boolean delete(String path) throws IOException;
}
