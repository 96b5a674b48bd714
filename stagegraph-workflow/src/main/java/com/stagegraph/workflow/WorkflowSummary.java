package com.stagegraph.workflow;

/** One line of the workflow catalog: manifest id, header fields and stage count. */
public final class WorkflowSummary {

    private final String id;
    private final String name;
    private final String persona;
    private final String description;
    private final int stageCount;

    public WorkflowSummary(String id, String name, String persona, String description, int stageCount) {
        this.id = id;
        this.name = name;
        this.persona = persona;
        this.description = description;
        this.stageCount = stageCount;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getPersona() {
        return persona;
    }

    /** First line of the manifest description. */
    public String getDescription() {
        return description;
    }

    public int getStageCount() {
        return stageCount;
    }

    @Override
    public String toString() {
        return id + " (" + name + ", " + stageCount + " stages)";
    }
}
