package com.stagegraph.readiness;

import com.stagegraph.definition.model.GraphDefinition;
import com.stagegraph.definition.parser.DefinitionParser;
import com.stagegraph.provenance.DigestFingerprintHasher;
import com.stagegraph.provenance.MutableClock;
import com.stagegraph.provenance.ProvenanceEngine;
import com.stagegraph.provenance.ProvenanceMetrics;
import com.stagegraph.store.InMemoryArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChainValidatorTest {

    private GraphDefinition definition;
    private InMemoryArtifactStore store;
    private MutableClock clock;
    private ProvenanceEngine engine;
    private final ChainValidator validator = new ChainValidator();

    @BeforeEach
    void setUp() {
        definition = new DefinitionParser().parseManifest("""
                name: Chain
                persona: tester
                stages:
                  - id: a
                    produces: [a.json]
                  - id: b
                    previous: a
                    produces: [b.json]
                  - id: c
                    previous: b
                    produces: [c.json]
                """);
        store = new InMemoryArtifactStore();
        clock = new MutableClock(Instant.parse("2026-05-01T00:00:00Z"));
        engine = new ProvenanceEngine(definition, store, "chain", DigestFingerprintHasher.sha256(), clock, ProvenanceMetrics.simple());
    }

    private void materializeInOrder(String... ids) {
        for (String id : ids) {
            clock.advance(Duration.ofSeconds(1));
            engine.materialize(id, Map.of("value", id));
        }
    }

    @Test
    void validate_freshChainIsValid() {
        materializeInOrder("a", "b", "c");

        ChainValidationResult result = validator.validate(definition, store, "chain");

        assertTrue(result.isValid());
        assertTrue(result.getStaleStages().isEmpty());
        assertTrue(result.getMissingStages().isEmpty());
    }

    @Test
    void validate_staleParentCascadesToDescendants() {
        materializeInOrder("a", "b", "c");
        clock.advance(Duration.ofSeconds(1));
        engine.materialize("a", Map.of("value", "a2"));

        ChainValidationResult result = validator.validate(definition, store, "chain");

        assertFalse(result.isValid());
        assertEquals(2, result.getStaleStages().size());
        StalenessResult b = result.getStaleStages().get(0);
        assertEquals("b", b.getStageId());
        assertEquals(List.of("a"), b.getStaleParents());
        StalenessResult c = result.getStaleStages().get(1);
        assertEquals("c", c.getStageId());
        assertTrue(c.isStale());
        assertEquals(List.of("b"), c.getStaleParents());
    }

    @Test
    void validate_reportsMissingStages() {
        materializeInOrder("a");

        ChainValidationResult result = validator.validate(definition, store, "chain");

        assertEquals(List.of("b", "c"), result.getMissingStages());
        assertFalse(result.isValid());
        assertEquals(List.of("a", "b", "c"), validator.validate(definition, store, "elsewhere").getMissingStages());
    }
}
