package com.stagegraph.definition.model;

/** Header metadata common to manifests and scripts. */
public interface DefinitionHeader {

    String getName();

    String getDescription();

    String getVersion();

    String getAuthors();
}
