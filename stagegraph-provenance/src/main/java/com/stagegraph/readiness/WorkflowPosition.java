package com.stagegraph.readiness;

import com.stagegraph.provenance.IntegrityWarning;

import java.util.List;

/**
 * Answer to "what is done, what is next, what is blocked" for one session.
 * Built fresh by {@link ReadinessEngine#resolvePosition} on every call.
 */
public final class WorkflowPosition {

    private final List<String> completedStages;
    private final String currentStage;
    private final String nextInstruction;
    private final List<String> availableCommands;
    private final List<String> staleStages;
    private final List<NodeReadiness> allReadiness;
    private final WorkflowProgress progress;
    private final boolean complete;
    private final List<IntegrityWarning> integrityWarnings;

    public WorkflowPosition(List<String> completedStages, String currentStage, String nextInstruction,
                            List<String> availableCommands, List<String> staleStages,
                            List<NodeReadiness> allReadiness, WorkflowProgress progress, boolean complete,
                            List<IntegrityWarning> integrityWarnings) {
        this.completedStages = List.copyOf(completedStages);
        this.currentStage = currentStage;
        this.nextInstruction = nextInstruction;
        this.availableCommands = List.copyOf(availableCommands);
        this.staleStages = List.copyOf(staleStages);
        this.allReadiness = List.copyOf(allReadiness);
        this.progress = progress;
        this.complete = complete;
        this.integrityWarnings = List.copyOf(integrityWarnings);
    }

    /** Complete stages in declaration order. */
    public List<String> getCompletedStages() {
        return completedStages;
    }

    /** First stage in declaration order that is ready and not complete, or null. */
    public String getCurrentStage() {
        return currentStage;
    }

    public String getNextInstruction() {
        return nextInstruction;
    }

    /** Commands of the current stage; empty when there is none. */
    public List<String> getAvailableCommands() {
        return availableCommands;
    }

    public List<String> getStaleStages() {
        return staleStages;
    }

    public List<NodeReadiness> getAllReadiness() {
        return allReadiness;
    }

    public NodeReadiness readinessOf(String stageId) {
        for (NodeReadiness readiness : allReadiness) {
            if (readiness.getStageId().equals(stageId)) return readiness;
        }
        return null;
    }

    public WorkflowProgress getProgress() {
        return progress;
    }

    /** Every terminal stage is complete. */
    public boolean isComplete() {
        return complete;
    }

    public List<IntegrityWarning> getIntegrityWarnings() {
        return integrityWarnings;
    }
}
