package com.stagegraph.workflow;

/**
 * Outcome of {@link WorkflowAdapter#checkTransition}. When not allowed, {@code skippedStageId}
 * names the pending parent that blocks the command; {@code hardBlock} tells whether the user
 * can proceed anyway after enough warnings.
 */
public final class TransitionResult {

    private static final TransitionResult ALLOWED = new TransitionResult(true, null, null, null, 0, false, null);

    private final boolean allowed;
    private final String warning;
    private final String reason;
    private final String suggestion;
    private final int skipCount;
    private final boolean hardBlock;
    private final String skippedStageId;

    public TransitionResult(boolean allowed, String warning, String reason, String suggestion,
                            int skipCount, boolean hardBlock, String skippedStageId) {
        this.allowed = allowed;
        this.warning = warning;
        this.reason = reason;
        this.suggestion = suggestion;
        this.skipCount = skipCount;
        this.hardBlock = hardBlock;
        this.skippedStageId = skippedStageId;
    }

    public static TransitionResult allowed() {
        return ALLOWED;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getWarning() {
        return warning;
    }

    /** Long explanation; only set from the second warning on. */
    public String getReason() {
        return reason;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /** Skips recorded for the blocking stage before this check. */
    public int getSkipCount() {
        return skipCount;
    }

    public boolean isHardBlock() {
        return hardBlock;
    }

    public String getSkippedStageId() {
        return skippedStageId;
    }

    @Override
    public String toString() {
        return "TransitionResult{allowed=" + allowed + ", hardBlock=" + hardBlock
                + ", skippedStageId=" + skippedStageId + ", warning=" + warning + "}";
    }
}
