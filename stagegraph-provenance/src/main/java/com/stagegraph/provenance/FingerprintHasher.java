package com.stagegraph.provenance;

import java.util.Map;

/**
 * Computes the Merkle fingerprint of an artifact from its content and the fingerprints of the
 * parents it was derived from. Equal inputs must give equal fingerprints regardless of map
 * insertion order.
 */
public interface FingerprintHasher {

    String fingerprint(Map<String, Object> content, Map<String, String> parentFingerprints);

    /** Digest algorithm name, for logs and config. */
    String getAlgorithm();
}
