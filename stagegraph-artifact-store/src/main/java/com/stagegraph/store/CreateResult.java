package com.stagegraph.store;

/** Outcome of {@link ArtifactStore#createAtomically}. */
public enum CreateResult {
    CREATED,
    ALREADY_EXISTS
}
