package com.stagegraph.readiness;

import java.util.List;

/** Result of walking a session's fingerprint chain. Valid when nothing is stale or missing. */
public final class ChainValidationResult {

    private final List<StalenessResult> staleStages;
    private final List<String> missingStages;

    public ChainValidationResult(List<StalenessResult> staleStages, List<String> missingStages) {
        this.staleStages = List.copyOf(staleStages);
        this.missingStages = List.copyOf(missingStages);
    }

    public boolean isValid() {
        return staleStages.isEmpty() && missingStages.isEmpty();
    }

    /** Stale stages in topological order. */
    public List<StalenessResult> getStaleStages() {
        return staleStages;
    }

    /** Stages without a trustworthy envelope, in topological order. */
    public List<String> getMissingStages() {
        return missingStages;
    }

    @Override
    public String toString() {
        return "ChainValidationResult{valid=" + isValid() + ", stale=" + staleStages + ", missing=" + missingStages + "}";
    }
}
