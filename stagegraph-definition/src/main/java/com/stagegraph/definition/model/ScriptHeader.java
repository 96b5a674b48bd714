package com.stagegraph.definition.model;

import java.util.Objects;

/** Header of a script: name, description, anchoring manifest reference, version, authors. */
public final class ScriptHeader implements DefinitionHeader {

    private final String name;
    private final String description;
    private final String manifest;
    private final String version;
    private final String authors;

    public ScriptHeader(String name, String description, String manifest, String version, String authors) {
        this.name = name != null ? name : "";
        this.description = description != null ? description : "";
        this.manifest = manifest;
        this.version = version != null ? version : "1.0.0";
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

    /** Manifest this script is anchored to (workflow id or manifest file name). */
    public String getManifest() {
        return manifest;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public String getAuthors() {
        return authors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScriptHeader that = (ScriptHeader) o;
        return name.equals(that.name) && description.equals(that.description)
                && Objects.equals(manifest, that.manifest) && version.equals(that.version)
                && authors.equals(that.authors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, manifest, version, authors);
    }
}
