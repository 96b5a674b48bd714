package com.stagegraph.workflow;

import com.stagegraph.config.StageGraphConfig;
import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.parser.DefinitionParser;
import com.stagegraph.provenance.DigestFingerprintHasher;
import com.stagegraph.provenance.FingerprintHasher;
import com.stagegraph.provenance.ProvenanceEngine;
import com.stagegraph.provenance.ProvenanceMetrics;
import com.stagegraph.readiness.ChainValidator;
import com.stagegraph.readiness.ReadinessEngine;
import com.stagegraph.store.ArtifactStore;
import com.stagegraph.store.FileSystemArtifactStore;
import com.stagegraph.store.InMemoryArtifactStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Everything a host needs to run workflows, wired from one {@link StageGraphConfig}: the artifact
 * store, the fingerprint hasher, metrics, the readiness and chain engines, the manifest registry
 * and the session manager. All parts are stateless apart from the store, so one runtime serves
 * any number of sessions.
 */
public final class WorkflowRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRuntime.class);

    private final StageGraphConfig config;
    private final ArtifactStore store;
    private final FingerprintHasher hasher;
    private final ProvenanceMetrics metrics;
    private final Clock clock;
    private final ReadinessEngine readinessEngine;
    private final ChainValidator chainValidator;
    private final ManifestRegistry registry;
    private final SessionManager sessions;

    public WorkflowRuntime(StageGraphConfig config, ArtifactStore store, ProvenanceMetrics metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.hasher = new DigestFingerprintHasher(config.getFingerprintAlgorithm());
        this.readinessEngine = new ReadinessEngine(hasher, metrics);
        this.chainValidator = new ChainValidator(hasher, metrics);
        this.registry = new ManifestRegistry(Path.of(config.getManifestDir()), new DefinitionParser());
        this.sessions = new SessionManager(store, config.getSessionBase(), clock);
    }

    public static WorkflowRuntime fromConfig(StageGraphConfig config) {
        ArtifactStore store = config.getStoreType() == StageGraphConfig.StoreType.MEMORY
                ? new InMemoryArtifactStore()
                : new FileSystemArtifactStore(Path.of(config.getStoreRoot()));
        log.info("Starting workflow runtime with {}", config);
        return new WorkflowRuntime(config, store, new ProvenanceMetrics(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    /** Adapter for workflow {@code workflowId}, freshly loaded from the manifest directory. */
    public WorkflowAdapter adapter(String workflowId) {
        return new WorkflowAdapter(workflowId, registry.load(workflowId), readinessEngine);
    }

    /** Provenance engine writing {@code definition}'s artifacts into {@code session}. */
    public ProvenanceEngine provenance(GraphDefinition definition, Session session) {
        String root = session.getRoot() != null
                ? session.getRoot()
                : sessions.sessionRoot(session.getPersona(), session.getId());
        return new ProvenanceEngine(definition, store, root, hasher, clock, metrics);
    }

    public StageGraphConfig getConfig() {
        return config;
    }

    public ArtifactStore getStore() {
        return store;
    }

    public FingerprintHasher getHasher() {
        return hasher;
    }

    public ProvenanceMetrics getMetrics() {
        return metrics;
    }

    public ReadinessEngine getReadinessEngine() {
        return readinessEngine;
    }

    public ChainValidator getChainValidator() {
        return chainValidator;
    }

    public ManifestRegistry getRegistry() {
        return registry;
    }

    public SessionManager getSessions() {
        return sessions;
    }
}
