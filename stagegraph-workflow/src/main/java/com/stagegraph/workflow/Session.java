package com.stagegraph.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Metadata of one workflow session, stored as {@code session.json} at the session root.
 * {@link #getRoot()} is where the session's stage tree lives; it is derived, not serialized.
 */
@JsonPropertyOrder({"id", "persona", "manifestVersion", "created", "lastActive"})
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Session {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String id;
    private final String persona;
    private final String manifestVersion;
    private final String created;
    private final String lastActive;
    private final String root;

    @JsonCreator
    public Session(
            @JsonProperty("id") String id,
            @JsonProperty("persona") String persona,
            @JsonProperty("manifestVersion") String manifestVersion,
            @JsonProperty("created") String created,
            @JsonProperty("lastActive") String lastActive) {
        this(id, persona, manifestVersion, created, lastActive, null);
    }

    Session(String id, String persona, String manifestVersion, String created, String lastActive, String root) {
        this.id = Objects.requireNonNull(id, "id");
        this.persona = persona;
        this.manifestVersion = manifestVersion;
        this.created = created;
        this.lastActive = lastActive != null ? lastActive : created;
        this.root = root;
    }

    Session withRoot(String sessionRoot) {
        return new Session(id, persona, manifestVersion, created, lastActive, sessionRoot);
    }

    public String getId() {
        return id;
    }

    public String getPersona() {
        return persona;
    }

    public String getManifestVersion() {
        return manifestVersion;
    }

    /** ISO-8601 creation instant. */
    public String getCreated() {
        return created;
    }

    public String getLastActive() {
        return lastActive;
    }

    /** Store path of the session root; null for a session not read through {@link SessionManager}. */
    @JsonIgnore
    public String getRoot() {
        return root;
    }

    byte[] toJsonBytes() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize session " + id, e);
        }
    }

    static Session fromJson(byte[] json) {
        try {
            return MAPPER.readValue(json, Session.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse session metadata", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Session that = (Session) o;
        return id.equals(that.id) && Objects.equals(persona, that.persona)
                && Objects.equals(manifestVersion, that.manifestVersion)
                && Objects.equals(created, that.created) && Objects.equals(root, that.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, persona, manifestVersion, created, root);
    }

    @Override
    public String toString() {
        return "Session{id=" + id + ", persona=" + persona + ", root=" + root + "}";
    }
}
