package com.stagegraph.store;

import java.util.List;

/**
 * Storage boundary for session trees. Paths are {@code /}-separated strings; the same path
 * denotes the same entry for every backend.
 * Envelopes are written once and never updated, so there is no overwrite operation:
 * {@link #createAtomically} either creates the file or reports that it already exists.
 * Failures surface as {@link ArtifactStoreException}.
 */
public interface ArtifactStore {

    /** True if a file or directory exists at {@code path}. */
    boolean exists(String path);

    /** File contents, or null when no file exists at {@code path}. */
    byte[] read(String path);

    /**
     * Creates the file at {@code path} with {@code bytes} if and only if nothing exists there yet.
     * Missing parent directories are created. Two concurrent calls for one path never both return
     * {@link CreateResult#CREATED}.
     */
    CreateResult createAtomically(String path, byte[] bytes);

    /** Names of direct children of the directory at {@code path}, sorted; empty when absent. */
    List<String> listChildren(String path);
}
