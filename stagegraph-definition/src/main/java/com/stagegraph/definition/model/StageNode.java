package com.stagegraph.definition.model;

import java.util.List;
import java.util.Objects;

/**
 * One stage of a workflow: a node in the stage graph.
 * Parents are declared backwards through {@code previous}; edges are derived by the parser and
 * never stored on the node. {@code previous == null} marks a root, a join lists several parents
 * and the first one is its primary (nesting) parent.
 * Every stage produces at least one artifact; a skipped optional stage produces a sentinel.
 */
public final class StageNode {

    private final String id;
    private final String name;
    private final String phase;
    private final List<String> previous;
    private final boolean optional;
    private final boolean structural;
    private final List<String> produces;
    private final StageParameters parameters;
    private final String instruction;
    private final List<String> commands;
    private final String handler;
    private final SkipWarning skipWarning;
    private final String narrative;
    private final List<String> blueprint;

    public StageNode(
            String id,
            String name,
            String phase,
            List<String> previous,
            boolean optional,
            boolean structural,
            List<String> produces,
            StageParameters parameters,
            String instruction,
            List<String> commands,
            String handler,
            SkipWarning skipWarning,
            String narrative,
            List<String> blueprint) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.phase = phase;
        this.previous = previous != null ? List.copyOf(previous) : null;
        this.optional = optional;
        this.structural = structural;
        this.produces = produces != null ? List.copyOf(produces) : List.of();
        this.parameters = parameters != null ? parameters : StageParameters.empty();
        this.instruction = instruction != null ? instruction : "";
        this.commands = commands != null ? List.copyOf(commands) : List.of();
        this.handler = handler;
        this.skipWarning = skipWarning;
        this.narrative = narrative;
        this.blueprint = blueprint != null ? List.copyOf(blueprint) : List.of();
    }

    public String getId() {
        return id;
    }

    /** Display name; falls back to the id. */
    public String getName() {
        return name;
    }

    /** Grouping tag for progress display, or null. */
    public String getPhase() {
        return phase;
    }

    /** Parent ids in declaration order, or null for a root. Unmodifiable. */
    public List<String> getPrevious() {
        return previous;
    }

    public boolean isRoot() {
        return previous == null;
    }

    /** First declared parent, or null for a root. */
    public String getPrimaryParent() {
        return previous != null && !previous.isEmpty() ? previous.get(0) : null;
    }

    public boolean isOptional() {
        return optional;
    }

    /** True for gate/join nodes that only shape topology and stay out of session paths. */
    public boolean isStructural() {
        return structural;
    }

    /** Artifact file names this stage materializes. */
    public List<String> getProduces() {
        return produces;
    }

    public StageParameters getParameters() {
        return parameters;
    }

    public boolean isSkipped() {
        return parameters.isSkipped();
    }

    public String getInstruction() {
        return instruction;
    }

    public List<String> getCommands() {
        return commands;
    }

    public String getHandler() {
        return handler;
    }

    public SkipWarning getSkipWarning() {
        return skipWarning;
    }

    public String getNarrative() {
        return narrative;
    }

    public List<String> getBlueprint() {
        return blueprint;
    }

    /** Returns a copy of this node with the given parameters (used by script overlays). */
    public StageNode withParameters(StageParameters newParameters) {
        return new StageNode(id, name, phase, previous, optional, structural, produces,
                newParameters, instruction, commands, handler, skipWarning, narrative, blueprint);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageNode that = (StageNode) o;
        return optional == that.optional && structural == that.structural
                && id.equals(that.id) && name.equals(that.name)
                && Objects.equals(phase, that.phase)
                && Objects.equals(previous, that.previous)
                && produces.equals(that.produces)
                && parameters.equals(that.parameters)
                && instruction.equals(that.instruction)
                && commands.equals(that.commands)
                && Objects.equals(handler, that.handler)
                && Objects.equals(skipWarning, that.skipWarning)
                && Objects.equals(narrative, that.narrative)
                && blueprint.equals(that.blueprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, phase, previous, optional, structural, produces, parameters,
                instruction, commands, handler, skipWarning, narrative, blueprint);
    }

    @Override
    public String toString() {
        return "StageNode{" + id + (previous != null ? " <- " + previous : " (root)") + "}";
    }
}
