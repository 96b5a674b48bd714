/**
 * Manifest and script parsing.
 * <ul>
 *   <li>{@link com.stagegraph.definition.parser.DefinitionParser} – {@code parseManifest} / {@code parseScript} facade</li>
 *   <li>{@link com.stagegraph.definition.parser.DefinitionParseException} – every {@link com.stagegraph.definition.parser.SchemaViolation} of a document in one error</li>
 *   <li>{@link com.stagegraph.definition.parser.UnknownStageReferenceException} – script override names a stage the manifest lacks</li>
 * </ul>
 * Documents are YAML (Jackson {@code YAMLFactory}); JSON works too.
 */
package com.stagegraph.definition.parser;
