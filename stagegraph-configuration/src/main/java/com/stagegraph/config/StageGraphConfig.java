package com.stagegraph.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables.
 * <p>
 * Manifests: STAGEGRAPH_MANIFEST_DIR (scanned for {@code <id>.manifest.yaml} and {@code <name>.script.yaml}).
 * Sessions: STAGEGRAPH_STORE ({@code filesystem} | {@code memory}), STAGEGRAPH_STORE_ROOT (filesystem store
 * directory), STAGEGRAPH_SESSION_BASE (store path under which session trees are created).
 * Fingerprints: STAGEGRAPH_FINGERPRINT_ALGORITHM ({@code MessageDigest} name).
 */
public final class StageGraphConfig {

    private static final Logger log = LoggerFactory.getLogger(StageGraphConfig.class);

    static final String ENV_MANIFEST_DIR = "STAGEGRAPH_MANIFEST_DIR";
    static final String ENV_SESSION_BASE = "STAGEGRAPH_SESSION_BASE";
    static final String ENV_STORE = "STAGEGRAPH_STORE";
    static final String ENV_STORE_ROOT = "STAGEGRAPH_STORE_ROOT";
    static final String ENV_FINGERPRINT_ALGORITHM = "STAGEGRAPH_FINGERPRINT_ALGORITHM";

    private static final String DEFAULT_MANIFEST_DIR = "manifests";
    private static final String DEFAULT_SESSION_BASE = "sessions";
    private static final String DEFAULT_STORE_ROOT = ".";
    private static final String DEFAULT_FINGERPRINT_ALGORITHM = "SHA-256";

    /** Backend for session trees. */
    public enum StoreType {
        FILESYSTEM,
        MEMORY
    }

    private final String manifestDir;
    private final String sessionBase;
    private final StoreType storeType;
    private final String storeRoot;
    private final String fingerprintAlgorithm;

    private StageGraphConfig(Builder b) {
        this.manifestDir = b.manifestDir;
        this.sessionBase = b.sessionBase;
        this.storeType = b.storeType;
        this.storeRoot = b.storeRoot;
        this.fingerprintAlgorithm = b.fingerprintAlgorithm;
    }

    /** Directory holding manifest and script YAML files. Default {@code manifests}. */
    public String getManifestDir() {
        return manifestDir;
    }

    /** Store path under which {@code <persona>/session-...} trees are created. Default {@code sessions}. */
    public String getSessionBase() {
        return sessionBase;
    }

    public StoreType getStoreType() {
        return storeType;
    }

    /** Host directory of the filesystem store. Default {@code .}; unused for the memory store. */
    public String getStoreRoot() {
        return storeRoot;
    }

    /** Digest used for artifact fingerprints. Default {@code SHA-256}. */
    public String getFingerprintAlgorithm() {
        return fingerprintAlgorithm;
    }

    public static StageGraphConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reads from {@code env}; blank values count as unset. */
    public static StageGraphConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .manifestDir(get(env, ENV_MANIFEST_DIR, DEFAULT_MANIFEST_DIR))
                .sessionBase(get(env, ENV_SESSION_BASE, DEFAULT_SESSION_BASE))
                .storeType(parseStoreType(env.get(ENV_STORE)))
                .storeRoot(get(env, ENV_STORE_ROOT, DEFAULT_STORE_ROOT))
                .fingerprintAlgorithm(get(env, ENV_FINGERPRINT_ALGORITHM, DEFAULT_FINGERPRINT_ALGORITHM))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static StoreType parseStoreType(String value) {
        if (value == null || value.isBlank()) {
            return StoreType.FILESYSTEM;
        }
        try {
            return StoreType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown {}={}, using filesystem", ENV_STORE, value);
            return StoreType.FILESYSTEM;
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "StageGraphConfig{manifestDir=" + manifestDir + ", sessionBase=" + sessionBase
                + ", store=" + storeType + ", storeRoot=" + storeRoot
                + ", fingerprintAlgorithm=" + fingerprintAlgorithm + "}";
    }

    public static final class Builder {
        private String manifestDir = DEFAULT_MANIFEST_DIR;
        private String sessionBase = DEFAULT_SESSION_BASE;
        private StoreType storeType = StoreType.FILESYSTEM;
        private String storeRoot = DEFAULT_STORE_ROOT;
        private String fingerprintAlgorithm = DEFAULT_FINGERPRINT_ALGORITHM;

        public Builder manifestDir(String manifestDir) {
            this.manifestDir = manifestDir != null ? manifestDir : DEFAULT_MANIFEST_DIR;
            return this;
        }

        public Builder sessionBase(String sessionBase) {
            this.sessionBase = sessionBase != null ? sessionBase : DEFAULT_SESSION_BASE;
            return this;
        }

        public Builder storeType(StoreType storeType) {
            this.storeType = Objects.requireNonNull(storeType, "storeType");
            return this;
        }

        public Builder storeRoot(String storeRoot) {
            this.storeRoot = storeRoot != null ? storeRoot : DEFAULT_STORE_ROOT;
            return this;
        }

        public Builder fingerprintAlgorithm(String fingerprintAlgorithm) {
            this.fingerprintAlgorithm = fingerprintAlgorithm != null ? fingerprintAlgorithm : DEFAULT_FINGERPRINT_ALGORITHM;
            return this;
        }

        public StageGraphConfig build() {
            return new StageGraphConfig(this);
        }
    }
}
