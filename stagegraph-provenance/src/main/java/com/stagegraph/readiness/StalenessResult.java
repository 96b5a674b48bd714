package com.stagegraph.readiness;

import java.util.List;

/** One stage found stale by {@link ChainValidator}, with the parents that made it so. */
public final class StalenessResult {

    private final String stageId;
    private final boolean stale;
    private final List<String> staleParents;
    private final String currentFingerprint;

    public StalenessResult(String stageId, boolean stale, List<String> staleParents, String currentFingerprint) {
        this.stageId = stageId;
        this.stale = stale;
        this.staleParents = staleParents != null ? List.copyOf(staleParents) : List.of();
        this.currentFingerprint = currentFingerprint;
    }

    public String getStageId() {
        return stageId;
    }

    public boolean isStale() {
        return stale;
    }

    /** Parents whose fingerprint changed, or which are themselves stale. */
    public List<String> getStaleParents() {
        return staleParents;
    }

    /** Fingerprint of the stage's own latest envelope. */
    public String getCurrentFingerprint() {
        return currentFingerprint;
    }

    @Override
    public String toString() {
        return stageId + (stale ? " stale via " + staleParents : " fresh");
    }
}
