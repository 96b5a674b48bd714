package com.stagegraph.provenance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted record of one stage execution. Written once by {@link ProvenanceEngine}, never updated.
 * On disk this is a pretty-printed JSON object with exactly the fields
 * {@code stage, timestamp, parameters_used, content, _fingerprint, _parent_fingerprints}, in that order.
 * Unknown fields are ignored when reading.
 * <p>
 * {@code content} and {@code parameters_used} are held in their stored JSON form (string keys,
 * doubles for decimals, maps for beans), so an envelope built in memory equals and hashes like the
 * one read back from its file.
 */
@JsonPropertyOrder({"stage", "timestamp", "parameters_used", "content", "_fingerprint", "_parent_fingerprints"})
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ArtifactEnvelope {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT =
            new TypeReference<LinkedHashMap<String, Object>>() {
            };

    static final String SKIPPED_KEY = "skipped";
    static final String REASON_KEY = "reason";

    private final String stage;
    private final String timestamp;
    private final Map<String, Object> parametersUsed;
    private final Map<String, Object> content;
    private final String fingerprint;
    private final Map<String, String> parentFingerprints;

    @JsonCreator
    public ArtifactEnvelope(
            @JsonProperty("stage") String stage,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("parameters_used") Map<String, Object> parametersUsed,
            @JsonProperty("content") Map<String, Object> content,
            @JsonProperty("_fingerprint") String fingerprint,
            @JsonProperty("_parent_fingerprints") Map<String, String> parentFingerprints) {
        this.stage = stage;
        this.timestamp = timestamp;
        this.parametersUsed = asStored(parametersUsed);
        this.content = asStored(content);
        this.fingerprint = fingerprint;
        this.parentFingerprints = copy(parentFingerprints);
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    /** {@code source} as it reads back from JSON. Throws {@link UncheckedIOException} if it cannot be written. */
    static Map<String, Object> asStored(Map<String, Object> source) {
        if (source == null || source.isEmpty()) return Map.of();
        try {
            return Collections.unmodifiableMap(MAPPER.readValue(MAPPER.writeValueAsBytes(source), JSON_OBJECT));
        } catch (IOException e) {
            throw new UncheckedIOException("Envelope field is not JSON-serializable", e);
        }
    }

    @JsonProperty("stage")
    public String getStage() {
        return stage;
    }

    /** ISO-8601 instant with full sub-second precision. */
    @JsonProperty("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @JsonProperty("parameters_used")
    public Map<String, Object> getParametersUsed() {
        return parametersUsed;
    }

    @JsonProperty("content")
    public Map<String, Object> getContent() {
        return content;
    }

    @JsonProperty("_fingerprint")
    public String getFingerprint() {
        return fingerprint;
    }

    /** Parent id → that parent's fingerprint when this envelope was created. */
    @JsonProperty("_parent_fingerprints")
    public Map<String, String> getParentFingerprints() {
        return parentFingerprints;
    }

    /**
     * True for the placeholder written when an optional stage is skipped: content is exactly
     * {@code {skipped: true, reason: <text>}}. Real artifacts cannot set {@code skipped: true}.
     */
    @JsonIgnore
    public boolean isSkipSentinel() {
        return content.size() == 2
                && Boolean.TRUE.equals(content.get(SKIPPED_KEY))
                && content.get(REASON_KEY) instanceof String;
    }

    /** Required fields present; an envelope missing any of them is treated as corrupt. */
    @JsonIgnore
    public boolean isWellFormed() {
        return stage != null && !stage.isBlank()
                && timestamp != null && !timestamp.isBlank()
                && fingerprint != null && !fingerprint.isBlank();
    }

    /** Pretty-printed JSON, UTF-8. Throws {@link UncheckedIOException} on failure. */
    public byte[] toJsonBytes() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Deserializes from JSON. Throws {@link UncheckedIOException} on malformed input. */
    public static ArtifactEnvelope fromJson(byte[] json) {
        try {
            ArtifactEnvelope envelope = MAPPER.readValue(json, ArtifactEnvelope.class);
            if (envelope == null) {
                throw new IOException("envelope document is empty");
            }
            return envelope;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArtifactEnvelope that = (ArtifactEnvelope) o;
        return Objects.equals(stage, that.stage) && Objects.equals(timestamp, that.timestamp)
                && parametersUsed.equals(that.parametersUsed) && content.equals(that.content)
                && Objects.equals(fingerprint, that.fingerprint)
                && parentFingerprints.equals(that.parentFingerprints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, timestamp, parametersUsed, content, fingerprint, parentFingerprints);
    }

    @Override
    public String toString() {
        return "ArtifactEnvelope{stage=" + stage + ", timestamp=" + timestamp + ", fingerprint=" + fingerprint + "}";
    }
}
