package com.stagegraph.readiness;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.StageNode;
import com.stagegraph.definition.topology.TopologicalOrder;
import com.stagegraph.paths.SessionPathResolver;
import com.stagegraph.paths.StagePath;
import com.stagegraph.provenance.ArtifactEnvelope;
import com.stagegraph.provenance.DigestFingerprintHasher;
import com.stagegraph.provenance.EnvelopeLocator;
import com.stagegraph.provenance.FingerprintHasher;
import com.stagegraph.provenance.ProvenanceMetrics;
import com.stagegraph.provenance.StoredEnvelope;
import com.stagegraph.store.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validates the whole fingerprint chain of a session. Walks stages in topological order and
 * compares each envelope's recorded parent fingerprints with the parents' current ones.
 * Staleness cascades: a stage below a stale stage is stale too, even if its own recorded
 * fingerprints still match.
 */
public final class ChainValidator {

    private static final Logger log = LoggerFactory.getLogger(ChainValidator.class);

    private final FingerprintHasher hasher;
    private final ProvenanceMetrics metrics;

    public ChainValidator(FingerprintHasher hasher, ProvenanceMetrics metrics) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ChainValidator() {
        this(DigestFingerprintHasher.sha256(), ProvenanceMetrics.simple());
    }

    /**
     * @throws IllegalStateException if the definition contains a cycle
     */
    public ChainValidationResult validate(GraphDefinition definition, ArtifactStore store, String sessionRoot) {
        EnvelopeLocator locator = new EnvelopeLocator(store, sessionRoot, hasher, metrics);
        Map<String, StagePath> paths = SessionPathResolver.resolvePaths(definition);
        boolean rootExists = store.exists(sessionRoot);

        List<StalenessResult> staleStages = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        Map<String, String> current = new HashMap<>();
        Set<String> staleIds = new HashSet<>();

        for (String stageId : TopologicalOrder.of(definition)) {
            Optional<ArtifactEnvelope> envelope = rootExists
                    ? locator.latest(stageId, paths.get(stageId), null).map(StoredEnvelope::getEnvelope)
                    : Optional.empty();
            if (envelope.isEmpty()) {
                missing.add(stageId);
                continue;
            }
            ArtifactEnvelope own = envelope.get();
            current.put(stageId, own.getFingerprint());

            StageNode node = definition.getNode(stageId);
            List<String> parents = node.getPrevious() != null ? List.copyOf(new LinkedHashSet<>(node.getPrevious())) : List.of();
            List<String> staleParents = new ArrayList<>();
            for (Map.Entry<String, String> recorded : own.getParentFingerprints().entrySet()) {
                String now = current.get(recorded.getKey());
                if (now != null && !now.equals(recorded.getValue())) staleParents.add(recorded.getKey());
            }
            for (String parentId : parents) {
                if (staleIds.contains(parentId) && !staleParents.contains(parentId)) staleParents.add(parentId);
            }
            if (!staleParents.isEmpty()) {
                staleStages.add(new StalenessResult(stageId, true, staleParents, own.getFingerprint()));
                staleIds.add(stageId);
            }
        }

        ChainValidationResult result = new ChainValidationResult(staleStages, missing);
        log.debug("Chain validation sessionRoot={} stale={} missing={}", sessionRoot, staleIds, missing);
        return result;
    }
}
