package com.stagegraph.definition.parser;

/** A script override names a stage id that its anchoring manifest does not have. */
public class UnknownStageReferenceException extends DefinitionException {

    private final String stageId;

    public UnknownStageReferenceException(String stageId) {
        super("Script references nonexistent manifest stage: '" + stageId + "'");
        this.stageId = stageId;
    }

    public String getStageId() {
        return stageId;
    }
}
