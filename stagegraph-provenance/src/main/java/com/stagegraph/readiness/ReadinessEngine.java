package com.stagegraph.readiness;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.StageNode;
import com.stagegraph.paths.SessionPathResolver;
import com.stagegraph.paths.StagePath;
import com.stagegraph.provenance.ArtifactEnvelope;
import com.stagegraph.provenance.DigestFingerprintHasher;
import com.stagegraph.provenance.EnvelopeLocator;
import com.stagegraph.provenance.FingerprintHasher;
import com.stagegraph.provenance.IntegrityWarning;
import com.stagegraph.provenance.ProvenanceMetrics;
import com.stagegraph.provenance.StoredEnvelope;
import com.stagegraph.store.ArtifactStore;
import com.stagegraph.store.ArtifactStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes readiness, completeness, staleness and the workflow position of a session by reading
 * the envelopes the {@link com.stagegraph.provenance.ProvenanceEngine} wrote. Stateless and
 * thread-safe; everything is re-read on every call.
 * <p>
 * A missing session root or stage directory means "not complete". Untrustworthy envelopes count
 * as absent and come back as {@link IntegrityWarning}s. Only a store failure on the session root
 * itself propagates.
 */
public final class ReadinessEngine {

    private static final Logger log = LoggerFactory.getLogger(ReadinessEngine.class);

    private final FingerprintHasher hasher;
    private final ProvenanceMetrics metrics;

    public ReadinessEngine(FingerprintHasher hasher, ProvenanceMetrics metrics) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ReadinessEngine() {
        this(DigestFingerprintHasher.sha256(), ProvenanceMetrics.simple());
    }

    /**
     * Readiness of every stage, in declaration order.
     *
     * @throws ArtifactStoreException if the store cannot tell whether the session root exists
     */
    public List<NodeReadiness> resolveReadiness(GraphDefinition definition, ArtifactStore store, String sessionRoot) {
        return evaluate(definition, store, sessionRoot).readiness;
    }

    /**
     * Position of the session: completed stages, current stage and its commands, stale stages,
     * progress and integrity warnings.
     *
     * @throws ArtifactStoreException if the store cannot tell whether the session root exists
     */
    public WorkflowPosition resolvePosition(GraphDefinition definition, ArtifactStore store, String sessionRoot) {
        Evaluation evaluation = evaluate(definition, store, sessionRoot);

        List<String> completed = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        String current = null;
        for (NodeReadiness readiness : evaluation.readiness) {
            if (readiness.isComplete()) completed.add(readiness.getStageId());
            if (readiness.isStale()) stale.add(readiness.getStageId());
            if (current == null && readiness.isReady() && !readiness.isComplete()) current = readiness.getStageId();
        }

        StageNode currentNode = current != null ? definition.getNode(current) : null;
        String instruction = currentNode != null ? currentNode.getInstruction() : null;
        List<String> commands = currentNode != null ? currentNode.getCommands() : List.of();
        WorkflowProgress progress = new WorkflowProgress(completed.size(), definition.size(),
                currentNode != null ? currentNode.getPhase() : null);

        List<String> terminals = definition.getTerminalIds().isEmpty()
                ? definition.getOrderedNodeIds() : definition.getTerminalIds();
        boolean complete = definition.size() > 0 && completed.containsAll(terminals);

        log.debug("Resolved position sessionRoot={} current={} completed={}/{} stale={} warnings={}",
                sessionRoot, current, completed.size(), definition.size(), stale, evaluation.warnings.size());
        return new WorkflowPosition(completed, current, instruction, commands, stale,
                evaluation.readiness, progress, complete, evaluation.warnings);
    }

    private Evaluation evaluate(GraphDefinition definition, ArtifactStore store, String sessionRoot) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(store, "store");
        List<IntegrityWarning> warnings = new ArrayList<>();
        Map<String, ArtifactEnvelope> latest = new HashMap<>();

        if (store.exists(sessionRoot)) {
            EnvelopeLocator locator = new EnvelopeLocator(store, sessionRoot, hasher, metrics);
            Map<String, StagePath> paths = SessionPathResolver.resolvePaths(definition);
            for (StageNode node : definition.getNodes()) {
                locator.latest(node.getId(), paths.get(node.getId()), warnings)
                        .map(StoredEnvelope::getEnvelope)
                        .ifPresent(envelope -> latest.put(node.getId(), envelope));
            }
        } else {
            log.debug("Session root {} does not exist; nothing is complete", sessionRoot);
        }

        List<NodeReadiness> readiness = new ArrayList<>(definition.size());
        for (StageNode node : definition.getNodes()) {
            readiness.add(readinessOf(node, latest));
        }
        return new Evaluation(readiness, warnings);
    }

    private static NodeReadiness readinessOf(StageNode node, Map<String, ArtifactEnvelope> latest) {
        ArtifactEnvelope own = latest.get(node.getId());
        boolean complete = own != null;
        List<String> parents = node.getPrevious() != null ? List.copyOf(new LinkedHashSet<>(node.getPrevious())) : List.of();

        List<String> pending = new ArrayList<>();
        List<String> staleParents = new ArrayList<>();
        for (String parentId : parents) {
            ArtifactEnvelope parent = latest.get(parentId);
            if (parent == null) {
                pending.add(parentId);
                continue;
            }
            if (!complete) continue;
            String recorded = own.getParentFingerprints().get(parentId);
            if (recorded != null && !recorded.equals(parent.getFingerprint())) {
                staleParents.add(parentId);
            }
        }
        return new NodeReadiness(node.getId(), pending.isEmpty(), complete,
                complete && own.isSkipSentinel(), !staleParents.isEmpty(),
                pending, staleParents, complete ? own.getFingerprint() : null);
    }

    private static final class Evaluation {
        final List<NodeReadiness> readiness;
        final List<IntegrityWarning> warnings;

        Evaluation(List<NodeReadiness> readiness, List<IntegrityWarning> warnings) {
            this.readiness = readiness;
            this.warnings = warnings;
        }
    }
}
