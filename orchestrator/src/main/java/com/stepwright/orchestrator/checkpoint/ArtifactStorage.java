package com.stepwright.orchestrator.checkpoint;

/**
 * Blob store for checkpoint patches, checkpoint metadata and attempt state.
 * Paths are relative, '/'-separated, and must stay inside the store.
 */
public interface ArtifactStorage {

    void write(String relativePath, byte[] content);

    byte[] read(String relativePath);

    boolean exists(String relativePath);
}
