package com.stagegraph.readiness;

import java.util.List;

/**
 * Readiness of one stage at the moment of the query. Never cached.
 * {@code ready} only looks at parents: a complete stage can still be ready (re-execution).
 */
public final class NodeReadiness {

    private final String stageId;
    private final boolean ready;
    private final boolean complete;
    private final boolean skipped;
    private final boolean stale;
    private final List<String> pendingParents;
    private final List<String> staleParents;
    private final String fingerprint;

    public NodeReadiness(String stageId, boolean ready, boolean complete, boolean skipped, boolean stale,
                         List<String> pendingParents, List<String> staleParents, String fingerprint) {
        this.stageId = stageId;
        this.ready = ready;
        this.complete = complete;
        this.skipped = skipped;
        this.stale = stale;
        this.pendingParents = pendingParents != null ? List.copyOf(pendingParents) : List.of();
        this.staleParents = staleParents != null ? List.copyOf(staleParents) : List.of();
        this.fingerprint = fingerprint;
    }

    public String getStageId() {
        return stageId;
    }

    /** Every parent is complete (skip sentinels count). Roots are always ready. */
    public boolean isReady() {
        return ready;
    }

    /** A trustworthy envelope exists. */
    public boolean isComplete() {
        return complete;
    }

    /** The latest envelope is a skip sentinel. */
    public boolean isSkipped() {
        return skipped;
    }

    /** Complete, but some parent has been re-materialized since. */
    public boolean isStale() {
        return stale;
    }

    public List<String> getPendingParents() {
        return pendingParents;
    }

    public List<String> getStaleParents() {
        return staleParents;
    }

    /** Fingerprint of the latest envelope, or null when incomplete. */
    public String getFingerprint() {
        return fingerprint;
    }

    @Override
    public String toString() {
        return "NodeReadiness{" + stageId + " ready=" + ready + " complete=" + complete
                + (skipped ? " skipped" : "") + (stale ? " stale" + staleParents : "")
                + (pendingParents.isEmpty() ? "" : " pending=" + pendingParents) + "}";
    }
}
