package com.stagegraph.definition.model;

import java.util.Objects;

/**
 * Marks a stage as skipped for a run. Carried by {@link StageParameters} next to the
 * parameter map; executors and the readiness engine match on its presence instead of
 * looking for a reserved key. A skipped stage materializes a skip sentinel, not real output.
 */
public final class SkipMarker {

    private final String origin;

    public SkipMarker(String origin) {
        this.origin = origin != null && !origin.isBlank() ? origin : "unspecified";
    }

    /** Where the skip came from, e.g. {@code script:quick-run}. Never null. */
    public String getOrigin() {
        return origin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return origin.equals(((SkipMarker) o).origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin);
    }

    @Override
    public String toString() {
        return "SkipMarker{" + origin + "}";
    }
}
