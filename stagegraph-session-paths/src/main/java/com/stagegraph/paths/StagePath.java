package com.stagegraph.paths;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Where a stage's artifacts live inside a session tree, relative to the session root.
 * {@code dataDir} is {@code <nesting>/meta}; {@code artifactFile} is the primary artifact in it.
 */
public final class StagePath {

    public static final String DATA_DIR_NAME = "meta";

    private final String nesting;
    private final String dataDir;
    private final String artifactFile;

    public StagePath(String nesting, String artifactFileName) {
        this.nesting = Objects.requireNonNull(nesting, "nesting");
        this.dataDir = nesting + "/" + DATA_DIR_NAME;
        this.artifactFile = dataDir + "/" + Objects.requireNonNull(artifactFileName, "artifactFileName");
    }

    /** Slash-joined stage ids, root first, ending with the stage itself. */
    public String getNesting() {
        return nesting;
    }

    public List<String> getNestingSegments() {
        return List.copyOf(Arrays.asList(nesting.split("/")));
    }

    public String getDataDir() {
        return dataDir;
    }

    public String getArtifactFile() {
        return artifactFile;
    }

    /** File name part of {@link #getArtifactFile()}. */
    public String getArtifactFileName() {
        return artifactFile.substring(dataDir.length() + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StagePath that = (StagePath) o;
        return nesting.equals(that.nesting) && artifactFile.equals(that.artifactFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nesting, artifactFile);
    }

    @Override
    public String toString() {
        return "StagePath{dataDir=" + dataDir + ", artifactFile=" + artifactFile + "}";
    }
}
