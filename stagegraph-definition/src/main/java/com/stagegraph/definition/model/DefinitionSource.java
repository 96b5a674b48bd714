package com.stagegraph.definition.model;

/** Which kind of document a {@link GraphDefinition} was parsed from. */
public enum DefinitionSource {
    MANIFEST,
    SCRIPT
}
