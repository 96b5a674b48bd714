package com.stagegraph.provenance;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DigestFingerprintHasherTest {

    private final DigestFingerprintHasher hasher = DigestFingerprintHasher.sha256();

    @Test
    void fingerprint_ignoresInsertionOrderAtEveryLevel() {
        Map<String, Object> innerA = new LinkedHashMap<>();
        innerA.put("x", 1);
        innerA.put("y", List.of("p", "q"));
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("rows", 3);
        a.put("inner", innerA);

        Map<String, Object> innerB = new LinkedHashMap<>();
        innerB.put("y", List.of("p", "q"));
        innerB.put("x", 1);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("inner", innerB);
        b.put("rows", 3);

        Map<String, String> parentsA = new LinkedHashMap<>();
        parentsA.put("search", "aaa");
        parentsA.put("gather", "bbb");
        Map<String, String> parentsB = new LinkedHashMap<>();
        parentsB.put("gather", "bbb");
        parentsB.put("search", "aaa");

        assertEquals(hasher.fingerprint(a, parentsA), hasher.fingerprint(b, parentsB));
    }

    @Test
    void fingerprint_changesWithContentOrParents() {
        String base = hasher.fingerprint(Map.of("rows", 3), Map.of("search", "aaa"));

        assertNotEquals(base, hasher.fingerprint(Map.of("rows", 4), Map.of("search", "aaa")));
        assertNotEquals(base, hasher.fingerprint(Map.of("rows", 3), Map.of("search", "aab")));
        assertNotEquals(base, hasher.fingerprint(Map.of("rows", 3), Map.of()));
        assertNotEquals(base, hasher.fingerprint(Map.of("rows", 3), Map.of("other", "aaa")));
    }

    @Test
    void fingerprint_isLowercaseSha256Hex() {
        String fp = hasher.fingerprint(Map.of(), Map.of());

        assertEquals(64, fp.length());
        assertTrue(fp.matches("[0-9a-f]+"));
        assertEquals("SHA-256", hasher.getAlgorithm());
        // null maps hash like empty ones
        assertEquals(hasher.fingerprint(null, null), fp);
    }

    @Test
    void fingerprint_matchesContentReadBackFromJson() {
        Map<String, Object> inMemory = Map.of("counts", Map.of(2, "x", 10, "y"), "score", new BigDecimal("1.10"));
        Map<String, Object> readBack = Map.of("counts", Map.of("10", "y", "2", "x"), "score", 1.1);

        assertEquals(hasher.fingerprint(readBack, Map.of()), hasher.fingerprint(inMemory, Map.of()));
        assertEquals("{\"counts\":{\"10\":\"y\",\"2\":\"x\"},\"score\":1.1}",
                DigestFingerprintHasher.canonicalJson(inMemory));
    }

    @Test
    void canonicalJson_sortsKeys() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("b", 2);
        content.put("a", Map.of("d", 4, "c", 3));

        assertEquals("{\"a\":{\"c\":3,\"d\":4},\"b\":2}", DigestFingerprintHasher.canonicalJson(content));
    }

    @Test
    void constructor_rejectsUnknownAlgorithm() {
        assertThrows(IllegalArgumentException.class, () -> new DigestFingerprintHasher("NOPE-1"));
        assertEquals("SHA-512", new DigestFingerprintHasher("SHA-512").getAlgorithm());
    }
}
