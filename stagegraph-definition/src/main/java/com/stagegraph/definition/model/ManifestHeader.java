package com.stagegraph.definition.model;

import java.util.Objects;

/**
 * Header of a manifest: name, description, category, persona, version, locked, authors.
 * {@code locked} means the topology is not meant to be edited by users.
 */
public final class ManifestHeader implements DefinitionHeader {

    private final String name;
    private final String description;
    private final String category;
    private final String persona;
    private final String version;
    private final boolean locked;
    private final String authors;

    public ManifestHeader(String name, String description, String category, String persona,
                          String version, boolean locked, String authors) {
        this.name = name;
        this.description = description != null ? description : "";
        this.category = category != null ? category : "";
        this.persona = persona;
        this.version = version != null ? version : "1.0.0";
        this.locked = locked;
        this.authors = authors != null ? authors : "";
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public String getPersona() {
        return persona;
    }

    @Override
    public String getVersion() {
        return version;
    }

    public boolean isLocked() {
        return locked;
    }

    @Override
    public String getAuthors() {
        return authors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ManifestHeader that = (ManifestHeader) o;
        return locked == that.locked && Objects.equals(name, that.name)
                && description.equals(that.description) && category.equals(that.category)
                && Objects.equals(persona, that.persona) && version.equals(that.version)
                && authors.equals(that.authors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, category, persona, version, locked, authors);
    }
}
