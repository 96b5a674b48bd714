package com.stagegraph.provenance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * {@link FingerprintHasher} over a {@link MessageDigest} (SHA-256 unless configured otherwise).
 * Digest input: canonical JSON of the content, a NUL byte, then
 * {@code parentId:fingerprint} pairs sorted by parent id and joined with {@code ,}.
 * Output is lowercase hex.
 * <p>
 * The content is first put through a JSON write and read, so it hashes exactly like its copy read
 * back from an envelope file: keys become strings, decimals become doubles, beans become maps.
 * Map keys are then sorted at every level.
 */
public final class DigestFingerprintHasher implements FingerprintHasher {

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<Map<String, Object>>() {
    };

    private final String algorithm;

    public DigestFingerprintHasher(String algorithm) {
        this.algorithm = algorithm != null && !algorithm.isBlank() ? algorithm : DEFAULT_ALGORITHM;
        newDigest();
    }

    public static DigestFingerprintHasher sha256() {
        return new DigestFingerprintHasher(DEFAULT_ALGORITHM);
    }

    @Override
    public String fingerprint(Map<String, Object> content, Map<String, String> parentFingerprints) {
        String parents = new TreeMap<>(parentFingerprints != null ? parentFingerprints : Map.of())
                .entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining(","));
        String input = canonicalJson(content) + "\0" + parents;
        return HexFormat.of().formatHex(newDigest().digest(input.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    static String canonicalJson(Map<String, Object> content) {
        try {
            byte[] stored = CANONICAL.writeValueAsBytes(content != null ? content : Map.of());
            return CANONICAL.writeValueAsString(CANONICAL.readValue(stored, JSON_OBJECT));
        } catch (IOException e) {
            throw new UncheckedIOException("Content is not JSON-serializable", e);
        }
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported fingerprint algorithm: " + algorithm, e);
        }
    }
}
