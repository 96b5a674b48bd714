package com.stagegraph.provenance;

import java.util.Objects;

/**
 * An envelope that exists but cannot be trusted. Distinct from "not yet produced": the stage is
 * reported incomplete for that file and the warning says why.
 */
public final class IntegrityWarning {

    public enum Kind {
        /** Not valid JSON, or required envelope fields are missing. */
        CORRUPT_ENVELOPE,
        /** Recorded {@code _fingerprint} differs from the recomputed one. */
        FINGERPRINT_MISMATCH,
        /** The store failed while reading the file. */
        UNREADABLE
    }

    private final String stageId;
    private final String path;
    private final Kind kind;
    private final String message;

    public IntegrityWarning(String stageId, String path, Kind kind, String message) {
        this.stageId = stageId;
        this.path = path;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message != null ? message : "";
    }

    public String getStageId() {
        return stageId;
    }

    /** Store path of the offending file. */
    public String getPath() {
        return path;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntegrityWarning that = (IntegrityWarning) o;
        return Objects.equals(stageId, that.stageId) && Objects.equals(path, that.path)
                && kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stageId, path, kind, message);
    }

    @Override
    public String toString() {
        return kind + " " + path + " (stage " + stageId + "): " + message;
    }
}
