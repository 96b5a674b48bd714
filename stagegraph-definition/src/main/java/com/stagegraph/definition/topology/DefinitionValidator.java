package com.stagegraph.definition.topology;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.StageNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks for a definition built by any means (parsed, or assembled in code):
 * at least one root, every stage produces something, no orphan parent references, no cycles.
 * Returns all problems at once instead of throwing.
 */
public final class DefinitionValidator {

    private DefinitionValidator() {
    }

    public static ValidationResult validate(GraphDefinition definition) {
        List<String> errors = new ArrayList<>();
        if (definition.size() == 0) {
            errors.add("Definition has no stages");
            return new ValidationResult(errors);
        }
        if (definition.getNodes().stream().noneMatch(StageNode::isRoot)) {
            errors.add("No root stage found (a stage with no previous)");
        }
        for (StageNode node : definition.getNodes()) {
            if (node.getProduces().isEmpty()) {
                errors.add("Stage '" + node.getId() + "' produces no artifacts");
            }
            if (node.getPrevious() != null && node.getPrevious().isEmpty()) {
                errors.add("Stage '" + node.getId() + "' has an empty previous list");
            }
            for (String parent : definition.parentsOf(node.getId())) {
                if (!definition.containsNode(parent)) {
                    errors.add("Stage '" + node.getId() + "' references unknown parent '" + parent + "'");
                }
            }
        }
        List<String> cycle = TopologicalOrder.cycleMembers(definition);
        if (!cycle.isEmpty()) {
            errors.add("Cycle detected among stages: " + cycle);
        }
        return new ValidationResult(errors);
    }
}
