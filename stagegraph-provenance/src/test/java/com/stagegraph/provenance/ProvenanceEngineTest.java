package com.stagegraph.provenance;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.parser.DefinitionParser;
import com.stagegraph.store.ArtifactStore;
import com.stagegraph.store.ArtifactStoreException;
import com.stagegraph.store.CreateResult;
import com.stagegraph.store.InMemoryArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProvenanceEngineTest {

    static final String MANIFEST = """
            name: Discovery
            persona: fedml
            stages:
              - id: search
                optional: true
                produces: [search.json]
                parameters:
                  limit: 10
              - id: gather
                previous: search
                produces: [gather.json]
              - id: harmonize
                previous: gather
                produces: [harmonize.json]
            """;

    private static final Instant START = Instant.parse("2026-01-01T10:00:00.123456Z");

    private GraphDefinition definition;
    private InMemoryArtifactStore store;
    private MutableClock clock;
    private ProvenanceMetrics metrics;
    private ProvenanceEngine engine;

    @BeforeEach
    void setUp() {
        definition = new DefinitionParser().parseManifest(MANIFEST);
        store = new InMemoryArtifactStore();
        clock = new MutableClock(START);
        metrics = ProvenanceMetrics.simple();
        engine = new ProvenanceEngine(definition, store, "sessions/fedml/s1", DigestFingerprintHasher.sha256(), clock, metrics);
    }

    @Test
    void materialize_writesEnvelopeAtCanonicalPath() {
        ArtifactEnvelope envelope = engine.materialize("search", Map.of("hits", 42));

        byte[] bytes = store.read("sessions/fedml/s1/search/meta/search.json");
        assertNotNull(bytes);
        assertEquals(envelope, ArtifactEnvelope.fromJson(bytes));
        assertEquals("search", envelope.getStage());
        assertEquals("2026-01-01T10:00:00.123456Z", envelope.getTimestamp());
        assertEquals(Map.of("limit", 10), envelope.getParametersUsed());
        assertEquals(Map.of(), envelope.getParentFingerprints());
        assertTrue(engine.verify(envelope));
        assertEquals(1.0, metrics.getRegistry().counter(ProvenanceMetrics.MATERIALIZED, "stage", "search", "kind", "artifact").count());
    }

    @Test
    void materialize_writesFieldsInFixedOrder() {
        engine.materialize("search", Map.of("hits", 1));

        String json = new String(store.read("sessions/fedml/s1/search/meta/search.json"), StandardCharsets.UTF_8);
        List<String> fields = List.of("\"stage\"", "\"timestamp\"", "\"parameters_used\"", "\"content\"",
                "\"_fingerprint\"", "\"_parent_fingerprints\"");
        int last = -1;
        for (String field : fields) {
            int at = json.indexOf(field);
            assertTrue(at > last, field + " out of order in " + json);
            last = at;
        }
        assertTrue(json.contains("\n"));
    }

    @Test
    void materialize_recordsParentFingerprints() {
        ArtifactEnvelope search = engine.materialize("search", Map.of("hits", 42));
        clock.advance(Duration.ofSeconds(1));
        ArtifactEnvelope gather = engine.materialize("gather", Map.of("rows", 7), Map.of("mode", "fast"));

        assertEquals(Map.of("search", search.getFingerprint()), gather.getParentFingerprints());
        assertEquals(Map.of("mode", "fast"), gather.getParametersUsed());
        assertNotNull(store.read("sessions/fedml/s1/search/gather/meta/gather.json"));
        assertEquals(gather.getFingerprint(), engine.fingerprintOf("gather"));
    }

    @Test
    void materialize_reExecutionBranchesInsteadOfOverwriting() {
        ArtifactEnvelope first = engine.materialize("search", Map.of("hits", 1));
        clock.advance(Duration.ofMillis(5));
        ArtifactEnvelope second = engine.materialize("search", Map.of("hits", 2));

        long millis = START.plusMillis(5).toEpochMilli();
        assertEquals(first, ArtifactEnvelope.fromJson(store.read("sessions/fedml/s1/search/meta/search.json")));
        assertEquals(second, ArtifactEnvelope.fromJson(
                store.read("sessions/fedml/s1/search_BRANCH_" + millis + "/meta/search.json")));
        assertEquals(second.getFingerprint(), engine.fingerprintOf("search"));
        assertEquals(1.0, metrics.getRegistry().counter(ProvenanceMetrics.BRANCHED, "stage", "search").count());
    }

    @Test
    void materialize_sameMillisecondBranchesGetNumberedSuffix() {
        engine.materialize("search", Map.of("run", 1));
        engine.materialize("search", Map.of("run", 2));
        ArtifactEnvelope third = engine.materialize("search", Map.of("run", 3));

        long millis = START.toEpochMilli();
        assertEquals(List.of("search", "search_BRANCH_" + millis, "search_BRANCH_" + millis + "-1"),
                store.listChildren("sessions/fedml/s1"));
        // equal timestamps: the branch whose name sorts last wins
        assertEquals(third.getFingerprint(), engine.fingerprintOf("search"));
    }

    @Test
    void materialize_childOfReExecutedParentRecordsLatestParent() {
        engine.materialize("search", Map.of("hits", 1));
        clock.advance(Duration.ofSeconds(1));
        ArtifactEnvelope rerun = engine.materialize("search", Map.of("hits", 2));
        clock.advance(Duration.ofSeconds(1));

        ArtifactEnvelope gather = engine.materialize("gather", Map.of("rows", 2));

        assertEquals(rerun.getFingerprint(), gather.getParentFingerprints().get("search"));
    }

    @Test
    void materializeSkipSentinel_onlyForOptionalOrSkippedStages() {
        ArtifactEnvelope sentinel = engine.materializeSkipSentinel("search", "not needed");

        assertTrue(sentinel.isSkipSentinel());
        assertEquals(Map.of("skipped", true, "reason", "not needed"), sentinel.getContent());
        assertEquals(1.0, metrics.getRegistry().counter(ProvenanceMetrics.MATERIALIZED, "stage", "search", "kind", "skip_sentinel").count());
        assertThrows(IllegalStateException.class, () -> engine.materializeSkipSentinel("gather", "no"));
    }

    @Test
    void materialize_rejectsContentShapedLikeSentinel() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.materialize("search", Map.of("skipped", true, "reason", "looks like a sentinel")));

        ArtifactEnvelope real = engine.materialize("search", Map.of("skipped", false, "reason", "none"));
        assertFalse(real.isSkipSentinel());
        ArtifactEnvelope extraKeys = new ArtifactEnvelope("search", START.toString(), null,
                Map.of("skipped", true, "reason", "x", "rows", 3), "fp", null);
        assertFalse(extraKeys.isSkipSentinel());
    }

    @Test
    void materializeSkipSentinel_allowedForScriptSkippedStage() {
        GraphDefinition script = new DefinitionParser().parseScript("""
                name: lean
                manifest: discovery
                stages:
                  - id: gather
                    skip: true
                """, definition);
        ProvenanceEngine scripted = new ProvenanceEngine(script, store, "s2", DigestFingerprintHasher.sha256(), clock, metrics);

        ArtifactEnvelope sentinel = scripted.materializeSkipSentinel("gather", null);

        assertEquals("skipped by script:lean", sentinel.getContent().get("reason"));
    }

    @Test
    void unknownStage_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> engine.materialize("nope", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> engine.fingerprintOf("nope"));
    }

    @Test
    void fingerprintOf_nullWhenNothingMaterialized() {
        assertNull(engine.fingerprintOf("search"));
        assertTrue(engine.latestEnvelope("harmonize").isEmpty());
    }

    @Test
    void verify_detectsTamperedContent() {
        ArtifactEnvelope envelope = engine.materialize("search", Map.of("hits", 42));
        ArtifactEnvelope tampered = new ArtifactEnvelope(envelope.getStage(), envelope.getTimestamp(),
                envelope.getParametersUsed(), Map.of("hits", 43), envelope.getFingerprint(), envelope.getParentFingerprints());

        assertTrue(engine.verify(envelope));
        assertFalse(engine.verify(tampered));
    }

    @Test
    void latestEnvelope_skipsTamperedFileOnDisk() {
        ArtifactEnvelope original = engine.materialize("search", Map.of("hits", 42));
        clock.advance(Duration.ofSeconds(1));
        ArtifactEnvelope forged = new ArtifactEnvelope("search", clock.instant().toString(), Map.of(),
                Map.of("hits", 9999), original.getFingerprint(), Map.of());
        store.createAtomically("sessions/fedml/s1/search_BRANCH_1/meta/search.json", forged.toJsonBytes());

        assertEquals(original, engine.latestEnvelope("search").orElseThrow());
        assertEquals(1.0, metrics.getRegistry().counter(ProvenanceMetrics.INTEGRITY_WARNINGS, "kind", "FINGERPRINT_MISMATCH").count());
    }

    @Test
    void materialize_propagatesStoreWriteFailure() {
        ArtifactStore failing = new ArtifactStore() {
            @Override
            public boolean exists(String path) {
                return false;
            }

            @Override
            public byte[] read(String path) {
                return null;
            }

            @Override
            public CreateResult createAtomically(String path, byte[] bytes) {
                throw new ArtifactStoreException(path, "disk full");
            }

            @Override
            public List<String> listChildren(String path) {
                return List.of();
            }
        };
        ProvenanceEngine broken = new ProvenanceEngine(definition, failing, "s");

        ArtifactStoreException e = assertThrows(ArtifactStoreException.class, () -> broken.materialize("search", Map.of()));
        assertTrue(e.getMessage().contains("disk full"));
    }

    @Test
    void materialize_contentReshapedByJsonStaysTrusted() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("counts", new TreeMap<>(Map.of(2, "x", 10, "y")));
        content.put("score", new BigDecimal("1.10"));

        ArtifactEnvelope written = engine.materialize("search", content);
        clock.advance(Duration.ofSeconds(1));
        ArtifactEnvelope gather = engine.materialize("gather", Map.of("rows", 1));

        assertEquals(Map.of("2", "x", "10", "y"), written.getContent().get("counts"));
        assertEquals(1.1, written.getContent().get("score"));
        assertEquals(written, ArtifactEnvelope.fromJson(store.read(engine.canonicalPath("search"))));
        assertEquals(written.getFingerprint(), engine.fingerprintOf("search"));
        assertEquals(written.getFingerprint(), gather.getParentFingerprints().get("search"));
        assertTrue(engine.verify(written));
        assertEquals(0.0, metrics.getRegistry()
                .counter(ProvenanceMetrics.INTEGRITY_WARNINGS, "kind", "FINGERPRINT_MISMATCH").count());
    }

    @Test
    void canonicalPath_followsSessionLayout() {
        assertEquals("sessions/fedml/s1/search/gather/harmonize/meta/harmonize.json", engine.canonicalPath("harmonize"));
        assertNotEquals(engine.canonicalPath("gather"), engine.canonicalPath("harmonize"));
    }
}
