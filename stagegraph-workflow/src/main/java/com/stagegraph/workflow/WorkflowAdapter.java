package com.stagegraph.workflow;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.SkipWarning;
import com.stagegraph.definition.model.StageNode;
import com.stagegraph.paths.SessionPathResolver;
import com.stagegraph.paths.StagePath;
import com.stagegraph.readiness.NodeReadiness;
import com.stagegraph.readiness.ReadinessEngine;
import com.stagegraph.readiness.WorkflowPosition;
import com.stagegraph.store.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One loaded workflow as a user-facing session sees it: which stage a typed command belongs to,
 * whether running it now is allowed, and a progress summary. Position and readiness always come
 * from the {@link ReadinessEngine}; the only state kept here is the per-stage skip counters.
 */
public final class WorkflowAdapter {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAdapter.class);

    private final String workflowId;
    private final GraphDefinition definition;
    private final ReadinessEngine readinessEngine;
    private final Map<String, StageNode> commandIndex;
    private final Map<String, StagePath> stagePaths;
    private final Map<String, Integer> skipCounts = new ConcurrentHashMap<>();

    public WorkflowAdapter(String workflowId, GraphDefinition definition, ReadinessEngine readinessEngine) {
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.readinessEngine = Objects.requireNonNull(readinessEngine, "readinessEngine");
        this.stagePaths = SessionPathResolver.resolvePaths(definition);
        this.commandIndex = buildCommandIndex(definition);
        log.debug("Built command index workflow={} commands={}", workflowId, commandIndex.keySet());
    }

    /**
     * Multi-word commands win over single-word ones; a single word maps to the stage with that id,
     * otherwise to the first stage using it as a verb unless another stage owns a longer command
     * starting with it.
     */
    private static Map<String, StageNode> buildCommandIndex(GraphDefinition definition) {
        Map<String, StageNode> index = new HashMap<>();
        for (StageNode node : definition.getNodes()) {
            for (String command : node.getCommands()) {
                String canonical = canonical(command);
                if (words(canonical).length > 1) {
                    index.putIfAbsent(canonical, node);
                }
            }
        }
        for (StageNode node : definition.getNodes()) {
            for (String command : node.getCommands()) {
                String canonical = canonical(command);
                if (words(canonical).length == 1 && canonical.equals(node.getId())) {
                    index.put(canonical, node);
                }
            }
        }
        for (StageNode node : definition.getNodes()) {
            for (String command : node.getCommands()) {
                String verb = firstWord(command);
                if (verb.isEmpty() || index.containsKey(verb)) continue;
                boolean shadowed = index.entrySet().stream().anyMatch(e -> {
                    String[] parts = words(e.getKey());
                    return parts.length > 1 && parts[0].equals(verb) && !e.getValue().getId().equals(node.getId());
                });
                if (!shadowed) {
                    index.put(verb, node);
                }
            }
        }
        return index;
    }

    /** Lower-cased command with its argument placeholders removed. */
    static String canonical(String command) {
        String text = command;
        int cut = indexOfAny(text, '<', '[');
        if (cut >= 0) text = text.substring(0, cut);
        return text.toLowerCase(Locale.ROOT).trim();
    }

    private static int indexOfAny(String text, char a, char b) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == a || c == b) return i;
        }
        return -1;
    }

    private static String[] words(String text) {
        return text.trim().split("\\s+");
    }

    private static String firstWord(String command) {
        String trimmed = command.trim();
        return trimmed.isEmpty() ? "" : words(trimmed)[0].toLowerCase(Locale.ROOT);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public GraphDefinition getDefinition() {
        return definition;
    }

    public Map<String, StagePath> getStagePaths() {
        return stagePaths;
    }

    /** Stage that handles {@code command}: full match first, then its first word. Null if none. */
    public StageNode stageForCommand(String command) {
        String trimmed = command.trim().toLowerCase(Locale.ROOT);
        StageNode full = commandIndex.get(trimmed);
        if (full != null) return full;
        return commandIndex.get(firstWord(trimmed));
    }

    public WorkflowPosition resolvePosition(ArtifactStore store, String sessionRoot) {
        return readinessEngine.resolvePosition(definition, store, sessionRoot);
    }

    /**
     * Whether {@code command} may run now. Commands outside the workflow and stages already
     * complete are always allowed. A pending required parent without a skip warning blocks hard;
     * a pending parent with a skip warning warns until it was skipped {@code maxWarnings} times.
     */
    public TransitionResult checkTransition(String command, ArtifactStore store, String sessionRoot) {
        StageNode target = stageForCommand(command);
        if (target == null) {
            return TransitionResult.allowed();
        }
        WorkflowPosition position = resolvePosition(store, sessionRoot);
        NodeReadiness readiness = position.readinessOf(target.getId());
        if (readiness == null || readiness.isComplete() || readiness.getPendingParents().isEmpty()) {
            return TransitionResult.allowed();
        }

        for (String parentId : readiness.getPendingParents()) {
            StageNode parent = definition.getNode(parentId);
            if (parent == null) continue;
            SkipWarning skipWarning = parent.getSkipWarning();

            if (!parent.isOptional() && skipWarning == null) {
                log.info("Transition blocked workflow={} command={} missing={}", workflowId, command, parentId);
                return new TransitionResult(false,
                        "PREREQUISITE NOT MET: " + parent.getName().toUpperCase(Locale.ROOT),
                        "This action requires completion of the '" + parent.getName() + "' stage.",
                        parent.getCommands().isEmpty()
                                ? "Complete the previous stage first."
                                : "Run '" + parent.getCommands().get(0) + "' to proceed.",
                        0, true, parentId);
            }

            if (skipWarning != null) {
                int skipCount = skipCounts.getOrDefault(parentId, 0);
                if (skipCount >= skipWarning.getMaxWarnings()) continue;
                log.info("Transition warned workflow={} command={} skipping={} skipCount={}",
                        workflowId, command, parentId, skipCount);
                return new TransitionResult(false,
                        skipWarning.getShortText(),
                        skipCount >= 1 ? skipWarning.getReason() : null,
                        parent.getCommands().isEmpty()
                                ? null
                                : "Run '" + parent.getCommands().get(0) + "' to complete this step.",
                        skipCount, false, parentId);
            }
        }
        return TransitionResult.allowed();
    }

    /** Records that the user proceeded past a warning for {@code stageId}; returns the new count. */
    public int incrementSkip(String stageId) {
        return skipCounts.merge(stageId, 1, Integer::sum);
    }

    /** Clears the skip counter once the stage is done. */
    public void completeStage(String stageId) {
        skipCounts.remove(stageId);
    }

    public int skipCount(String stageId) {
        return skipCounts.getOrDefault(stageId, 0);
    }

    /** Human-readable progress: one line per stage, {@code ●} complete, {@code ○} open, {@code *} stale. */
    public String summarizeProgress(ArtifactStore store, String sessionRoot) {
        WorkflowPosition position = resolvePosition(store, sessionRoot);
        StringBuilder summary = new StringBuilder()
                .append("Workflow: ").append(definition.getHeader().getName()).append('\n')
                .append("Progress: ").append(position.getProgress().getCompleted()).append('/')
                .append(position.getProgress().getTotal()).append(" stages\n\n");
        for (StageNode node : definition.getNodes()) {
            boolean stale = position.getStaleStages().contains(node.getId());
            boolean complete = position.getCompletedStages().contains(node.getId());
            summary.append("  ").append(stale ? '*' : complete ? '●' : '○').append(' ').append(node.getName());
            if (stale) summary.append(" [STALE]");
            if (node.getId().equals(position.getCurrentStage())) summary.append(" ← NEXT");
            summary.append('\n');
        }
        return summary.toString();
    }
}
