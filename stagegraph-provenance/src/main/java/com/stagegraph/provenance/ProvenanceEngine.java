package com.stagegraph.provenance;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.model.StageNode;
import com.stagegraph.paths.SessionPathResolver;
import com.stagegraph.paths.StagePath;
import com.stagegraph.store.ArtifactStore;
import com.stagegraph.store.ArtifactStoreException;
import com.stagegraph.store.CreateResult;
import com.stagegraph.store.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Materializes stage outputs into one session tree as fingerprinted {@link ArtifactEnvelope}s.
 * <p>
 * Each envelope records the latest fingerprint of every parent it was derived from, so any
 * artifact can prove which upstream artifacts produced it. Files are created with the store's
 * atomic create; an existing envelope is never overwritten. A re-execution goes to a sibling
 * directory {@code <id>_BRANCH_<epochMillis>}, suffixed {@code -1}, {@code -2}, ... when that
 * name is taken too.
 * <p>
 * Not synchronized: callers keep to one writer per (session, stage).
 */
public final class ProvenanceEngine {

    private static final Logger log = LoggerFactory.getLogger(ProvenanceEngine.class);

    private static final int MAX_BRANCH_ATTEMPTS = 1000;

    private final GraphDefinition definition;
    private final ArtifactStore store;
    private final String sessionRoot;
    private final FingerprintHasher hasher;
    private final Clock clock;
    private final ProvenanceMetrics metrics;
    private final Map<String, StagePath> paths;
    private final EnvelopeLocator locator;

    public ProvenanceEngine(GraphDefinition definition, ArtifactStore store, String sessionRoot,
                            FingerprintHasher hasher, Clock clock, ProvenanceMetrics metrics) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.store = Objects.requireNonNull(store, "store");
        this.sessionRoot = StorePaths.normalize(Objects.requireNonNull(sessionRoot, "sessionRoot"));
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.paths = SessionPathResolver.resolvePaths(definition);
        this.locator = new EnvelopeLocator(store, this.sessionRoot, hasher, metrics);
    }

    /** SHA-256 fingerprints, system UTC clock, metrics in a private {@code SimpleMeterRegistry}. */
    public ProvenanceEngine(GraphDefinition definition, ArtifactStore store, String sessionRoot) {
        this(definition, store, sessionRoot, DigestFingerprintHasher.sha256(), Clock.systemUTC(), ProvenanceMetrics.simple());
    }

    /**
     * Records {@code content} as the output of {@code stageId}, with the stage's effective
     * parameters as {@code parameters_used}.
     *
     * @throws IllegalArgumentException if the definition has no such stage, or the content carries
     *                                  {@code skipped: true}, which only skip sentinels may
     * @throws ArtifactStoreException   if the envelope cannot be written
     */
    public ArtifactEnvelope materialize(String stageId, Map<String, Object> content) {
        StageNode node = requireNode(stageId);
        return materialize(node, requireArtifactContent(stageId, content), node.getParameters().getValues(),
                ProvenanceMetrics.KIND_ARTIFACT);
    }

    /** As {@link #materialize(String, Map)} with explicit {@code parametersUsed}. */
    public ArtifactEnvelope materialize(String stageId, Map<String, Object> content, Map<String, Object> parametersUsed) {
        return materialize(requireNode(stageId), requireArtifactContent(stageId, content), parametersUsed,
                ProvenanceMetrics.KIND_ARTIFACT);
    }

    /**
     * Writes the placeholder envelope {@code {skipped: true, reason}} for a stage that will not run,
     * so its children become ready.
     *
     * @throws IllegalStateException if the stage is neither optional nor skipped by a script
     */
    public ArtifactEnvelope materializeSkipSentinel(String stageId, String reason) {
        StageNode node = requireNode(stageId);
        if (!node.isOptional() && !node.isSkipped()) {
            throw new IllegalStateException("Stage '" + stageId + "' is required and cannot be skipped");
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(ArtifactEnvelope.SKIPPED_KEY, Boolean.TRUE);
        content.put(ArtifactEnvelope.REASON_KEY, reason != null ? reason : defaultSkipReason(node));
        return materialize(node, content, node.getParameters().getValues(), ProvenanceMetrics.KIND_SKIP_SENTINEL);
    }

    /** Fingerprint of the stage's latest trustworthy envelope, or null when there is none. */
    public String fingerprintOf(String stageId) {
        return latestEnvelope(stageId).map(ArtifactEnvelope::getFingerprint).orElse(null);
    }

    public Optional<ArtifactEnvelope> latestEnvelope(String stageId) {
        StageNode node = requireNode(stageId);
        return locator.latest(node.getId(), paths.get(node.getId()), null).map(StoredEnvelope::getEnvelope);
    }

    /** True if the envelope's recorded fingerprint matches its content and recorded parents. */
    public boolean verify(ArtifactEnvelope envelope) {
        return envelope.getFingerprint() != null
                && envelope.getFingerprint().equals(hasher.fingerprint(envelope.getContent(), envelope.getParentFingerprints()));
    }

    /** Canonical location of the stage's envelope inside the session tree. */
    public String canonicalPath(String stageId) {
        requireNode(stageId);
        return StorePaths.join(sessionRoot, paths.get(stageId).getArtifactFile());
    }

    public String getSessionRoot() {
        return sessionRoot;
    }

    private ArtifactEnvelope materialize(StageNode node, Map<String, Object> content,
                                         Map<String, Object> parametersUsed, String kind) {
        Map<String, Object> body = ArtifactEnvelope.asStored(content);
        Map<String, String> parents = parentFingerprints(node);
        String fingerprint = hasher.fingerprint(body, parents);
        ArtifactEnvelope envelope = new ArtifactEnvelope(node.getId(), clock.instant().toString(),
                parametersUsed, body, fingerprint, parents);

        String written = write(node, envelope.toJsonBytes());
        metrics.materialized(node.getId(), kind);
        log.info("Materialized stage={} kind={} path={} fingerprint={}", node.getId(), kind, written, fingerprint);
        return envelope;
    }

    /** Latest fingerprint of every resolvable parent, in declaration order. */
    private Map<String, String> parentFingerprints(StageNode node) {
        Map<String, String> parents = new LinkedHashMap<>();
        if (node.getPrevious() == null) return parents;
        for (String parentId : new LinkedHashSet<>(node.getPrevious())) {
            StageNode parent = definition.getNode(parentId);
            if (parent == null) continue;
            locator.latest(parentId, paths.get(parentId), null)
                    .ifPresent(stored -> parents.put(parentId, stored.getEnvelope().getFingerprint()));
        }
        return parents;
    }

    private String write(StageNode node, byte[] bytes) {
        StagePath path = paths.get(node.getId());
        String canonical = StorePaths.join(sessionRoot, path.getArtifactFile());
        if (store.createAtomically(canonical, bytes) == CreateResult.CREATED) {
            return canonical;
        }

        String parentDir = locator.parentDirectory(path);
        String base = node.getId() + EnvelopeLocator.BRANCH_MARKER + clock.millis();
        for (int attempt = 0; attempt < MAX_BRANCH_ATTEMPTS; attempt++) {
            String directory = attempt == 0 ? base : base + "-" + attempt;
            String branch = StorePaths.join(parentDir, directory, StagePath.DATA_DIR_NAME, path.getArtifactFileName());
            if (store.createAtomically(branch, bytes) == CreateResult.CREATED) {
                metrics.branched(node.getId());
                log.info("Stage {} already materialized at {}, branched to {}", node.getId(), canonical, branch);
                return branch;
            }
        }
        throw new ArtifactStoreException(canonical, "no free branch directory after " + MAX_BRANCH_ATTEMPTS + " attempts");
    }

    private static Map<String, Object> requireArtifactContent(String stageId, Map<String, Object> content) {
        if (content != null && Boolean.TRUE.equals(content.get(ArtifactEnvelope.SKIPPED_KEY))) {
            throw new IllegalArgumentException("Content of stage '" + stageId + "' sets '"
                    + ArtifactEnvelope.SKIPPED_KEY + ": true', which is reserved for skip sentinels");
        }
        return content;
    }

    private StageNode requireNode(String stageId) {
        StageNode node = definition.getNode(stageId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown stage: '" + stageId + "'");
        }
        return node;
    }

    private static String defaultSkipReason(StageNode node) {
        return node.getParameters().getSkipMarker()
                .map(marker -> "skipped by " + marker.getOrigin())
                .orElse("optional stage skipped");
    }
}
