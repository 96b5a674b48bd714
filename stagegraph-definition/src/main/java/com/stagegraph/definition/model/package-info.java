/**
 * Stage graph model: immutable output of the definition parser.
 * <ul>
 *   <li>{@link com.stagegraph.definition.model.GraphDefinition} – nodes in declaration order, derived edges, roots, terminals</li>
 *   <li>{@link com.stagegraph.definition.model.StageNode} – one stage; parents via {@code previous}, first one is the primary parent</li>
 *   <li>{@link com.stagegraph.definition.model.StageParameters} – effective parameters plus an optional {@link com.stagegraph.definition.model.SkipMarker}</li>
 *   <li>{@link com.stagegraph.definition.model.ManifestHeader} / {@link com.stagegraph.definition.model.ScriptHeader} – document metadata</li>
 * </ul>
 */
package com.stagegraph.definition.model;
