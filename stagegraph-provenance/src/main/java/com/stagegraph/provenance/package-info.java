/**
 * Merkle provenance for stage artifacts.
 * <ul>
 *   <li>{@link com.stagegraph.provenance.ProvenanceEngine} – writes fingerprinted envelopes into a session tree, branching on re-execution</li>
 *   <li>{@link com.stagegraph.provenance.ArtifactEnvelope} – on-disk JSON record (Jackson)</li>
 *   <li>{@link com.stagegraph.provenance.FingerprintHasher} / {@link com.stagegraph.provenance.DigestFingerprintHasher} – content + parent fingerprints → hex digest</li>
 *   <li>{@link com.stagegraph.provenance.EnvelopeLocator} – latest trustworthy envelope of a stage, with {@link com.stagegraph.provenance.IntegrityWarning}s</li>
 *   <li>{@link com.stagegraph.provenance.ProvenanceMetrics} – Micrometer counters</li>
 * </ul>
 */
package com.stagegraph.provenance;
