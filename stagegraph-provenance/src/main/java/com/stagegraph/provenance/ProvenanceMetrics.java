package com.stagegraph.provenance;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/**
 * Micrometer counters for artifact materialization and integrity problems.
 * <ul>
 *   <li>{@code stagegraph.artifacts.materialized} – tags {@code stage}, {@code kind} ({@code artifact} | {@code skip_sentinel})</li>
 *   <li>{@code stagegraph.artifacts.branched} – tag {@code stage}; re-executions written beside the canonical path</li>
 *   <li>{@code stagegraph.integrity.warnings} – tag {@code kind}</li>
 * </ul>
 */
public final class ProvenanceMetrics {

    public static final String MATERIALIZED = "stagegraph.artifacts.materialized";
    public static final String BRANCHED = "stagegraph.artifacts.branched";
    public static final String INTEGRITY_WARNINGS = "stagegraph.integrity.warnings";

    public static final String KIND_ARTIFACT = "artifact";
    public static final String KIND_SKIP_SENTINEL = "skip_sentinel";

    private final MeterRegistry registry;

    public ProvenanceMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics backed by a fresh {@link SimpleMeterRegistry}. */
    public static ProvenanceMetrics simple() {
        return new ProvenanceMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    void materialized(String stageId, String kind) {
        registry.counter(MATERIALIZED, "stage", stageId, "kind", kind).increment();
    }

    void branched(String stageId) {
        registry.counter(BRANCHED, "stage", stageId).increment();
    }

    void integrityWarning(IntegrityWarning.Kind kind) {
        registry.counter(INTEGRITY_WARNINGS, "kind", kind.name()).increment();
    }
}
