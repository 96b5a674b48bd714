package com.stagegraph.readiness;

/** Completed/total counts plus the phase of the current stage (null when there is none). */
public final class WorkflowProgress {

    private final int completed;
    private final int total;
    private final String phase;

    public WorkflowProgress(int completed, int total, String phase) {
        this.completed = completed;
        this.total = total;
        this.phase = phase;
    }

    public int getCompleted() {
        return completed;
    }

    public int getTotal() {
        return total;
    }

    public String getPhase() {
        return phase;
    }

    @Override
    public String toString() {
        return completed + "/" + total + (phase != null ? " (" + phase + ")" : "");
    }
}
