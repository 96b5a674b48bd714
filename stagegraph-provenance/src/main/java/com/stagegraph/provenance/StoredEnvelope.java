package com.stagegraph.provenance;

import java.util.Objects;

/** An envelope together with the store path it was read from. */
public final class StoredEnvelope {

    private final ArtifactEnvelope envelope;
    private final String path;
    private final String directoryName;

    StoredEnvelope(ArtifactEnvelope envelope, String path, String directoryName) {
        this.envelope = Objects.requireNonNull(envelope, "envelope");
        this.path = path;
        this.directoryName = directoryName;
    }

    public ArtifactEnvelope getEnvelope() {
        return envelope;
    }

    public String getPath() {
        return path;
    }

    /** Stage directory the envelope sits under: the stage id, or {@code <id>_BRANCH_...}. */
    public String getDirectoryName() {
        return directoryName;
    }

    public boolean isBranch() {
        return directoryName.contains(EnvelopeLocator.BRANCH_MARKER);
    }
}
