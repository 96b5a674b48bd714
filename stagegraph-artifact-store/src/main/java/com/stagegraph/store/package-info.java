/**
 * Artifact store boundary used by the provenance and readiness engines.
 * <ul>
 *   <li>{@link com.stagegraph.store.ArtifactStore} – exists / read / createAtomically / listChildren</li>
 *   <li>{@link com.stagegraph.store.InMemoryArtifactStore} – thread-safe map, for tests and embedding</li>
 *   <li>{@link com.stagegraph.store.FileSystemArtifactStore} – host directory, temp file + hard link for atomic create</li>
 * </ul>
 */
package com.stagegraph.store;
