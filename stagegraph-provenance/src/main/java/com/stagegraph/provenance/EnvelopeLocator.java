package com.stagegraph.provenance;

import com.stagegraph.paths.StagePath;
import com.stagegraph.store.ArtifactStore;
import com.stagegraph.store.ArtifactStoreException;
import com.stagegraph.store.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the envelopes of a stage inside one session tree. A stage's envelopes live in its canonical
 * directory ({@code .../<id>/meta/<artifact>}) and in re-execution siblings
 * ({@code .../<id>_BRANCH_<millis>[-n]/meta/<artifact>}).
 * <p>
 * Every candidate is parsed and its fingerprint recomputed. Files that fail either check are left
 * out and reported as {@link IntegrityWarning}s (logged at WARN, counted in metrics). The latest
 * envelope is the one with the greatest timestamp. Equal timestamps go to a branch over the canonical
 * directory, then to the branch with the greater millis and sequence suffix.
 */
public final class EnvelopeLocator {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeLocator.class);

    static final String BRANCH_MARKER = "_BRANCH_";

    private static final Comparator<StoredEnvelope> LATEST_LAST = Comparator
            .comparing((StoredEnvelope s) -> parseInstant(s.getEnvelope().getTimestamp()))
            .thenComparingInt(s -> s.isBranch() ? 1 : 0)
            .thenComparingLong(s -> branchMillis(s.getDirectoryName()))
            .thenComparingInt(s -> branchSequence(s.getDirectoryName()))
            .thenComparing(StoredEnvelope::getDirectoryName);

    private final ArtifactStore store;
    private final String sessionRoot;
    private final FingerprintHasher hasher;
    private final ProvenanceMetrics metrics;

    public EnvelopeLocator(ArtifactStore store, String sessionRoot, FingerprintHasher hasher, ProvenanceMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.sessionRoot = StorePaths.normalize(Objects.requireNonNull(sessionRoot, "sessionRoot"));
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Latest trustworthy envelope for {@code stageId}, or empty when none exists.
     *
     * @param warnings receives one entry per file that exists but could not be trusted
     */
    public Optional<StoredEnvelope> latest(String stageId, StagePath path, List<IntegrityWarning> warnings) {
        List<StoredEnvelope> envelopes = all(stageId, path, warnings);
        return envelopes.isEmpty() ? Optional.empty() : Optional.of(envelopes.get(envelopes.size() - 1));
    }

    /** Every trustworthy envelope for {@code stageId}, oldest first. */
    public List<StoredEnvelope> all(String stageId, StagePath path, List<IntegrityWarning> warnings) {
        String parentDir = parentDirectory(path);
        List<String> children;
        try {
            children = store.listChildren(parentDir);
        } catch (ArtifactStoreException e) {
            report(warnings, new IntegrityWarning(stageId, parentDir, IntegrityWarning.Kind.UNREADABLE, e.getMessage()));
            return List.of();
        }

        List<StoredEnvelope> found = new ArrayList<>();
        for (String name : children) {
            if (!name.equals(stageId) && !name.startsWith(stageId + BRANCH_MARKER)) continue;
            String file = StorePaths.join(parentDir, name, StagePath.DATA_DIR_NAME, path.getArtifactFileName());
            StoredEnvelope envelope = readVerified(stageId, file, name, warnings);
            if (envelope != null) found.add(envelope);
        }
        found.sort(LATEST_LAST);
        return found;
    }

    /** Store directory that holds the stage directory and its branches. */
    String parentDirectory(StagePath path) {
        String nesting = path.getNesting();
        int slash = nesting.lastIndexOf('/');
        return slash < 0 ? sessionRoot : StorePaths.join(sessionRoot, nesting.substring(0, slash));
    }

    private StoredEnvelope readVerified(String stageId, String file, String directoryName, List<IntegrityWarning> warnings) {
        byte[] bytes;
        try {
            bytes = store.read(file);
        } catch (ArtifactStoreException e) {
            report(warnings, new IntegrityWarning(stageId, file, IntegrityWarning.Kind.UNREADABLE, e.getMessage()));
            return null;
        }
        if (bytes == null) return null;

        ArtifactEnvelope envelope;
        try {
            envelope = ArtifactEnvelope.fromJson(bytes);
        } catch (UncheckedIOException e) {
            report(warnings, new IntegrityWarning(stageId, file, IntegrityWarning.Kind.CORRUPT_ENVELOPE,
                    "unparsable envelope: " + e.getCause().getMessage()));
            return null;
        }
        if (!envelope.isWellFormed()) {
            report(warnings, new IntegrityWarning(stageId, file, IntegrityWarning.Kind.CORRUPT_ENVELOPE,
                    "envelope is missing stage, timestamp or _fingerprint"));
            return null;
        }
        if (!stageId.equals(envelope.getStage())) {
            report(warnings, new IntegrityWarning(stageId, file, IntegrityWarning.Kind.CORRUPT_ENVELOPE,
                    "envelope belongs to stage '" + envelope.getStage() + "'"));
            return null;
        }
        if (parseInstant(envelope.getTimestamp()) == null) {
            report(warnings, new IntegrityWarning(stageId, file, IntegrityWarning.Kind.CORRUPT_ENVELOPE,
                    "invalid timestamp '" + envelope.getTimestamp() + "'"));
            return null;
        }
        String recomputed = hasher.fingerprint(envelope.getContent(), envelope.getParentFingerprints());
        if (!recomputed.equals(envelope.getFingerprint())) {
            report(warnings, new IntegrityWarning(stageId, file, IntegrityWarning.Kind.FINGERPRINT_MISMATCH,
                    "recorded " + envelope.getFingerprint() + " but content hashes to " + recomputed));
            return null;
        }
        return new StoredEnvelope(envelope, file, directoryName);
    }

    private void report(List<IntegrityWarning> warnings, IntegrityWarning warning) {
        log.warn("Integrity warning kind={} stage={} path={}: {}",
                warning.getKind(), warning.getStageId(), warning.getPath(), warning.getMessage());
        metrics.integrityWarning(warning.getKind());
        if (warnings != null) warnings.add(warning);
    }

    /** Millis part of {@code <id>_BRANCH_<millis>[-n]}; -1 for the canonical or a foreign name. */
    static long branchMillis(String directoryName) {
        int marker = directoryName.indexOf(BRANCH_MARKER);
        if (marker < 0) return -1;
        String suffix = directoryName.substring(marker + BRANCH_MARKER.length());
        int dash = suffix.indexOf('-');
        try {
            return Long.parseLong(dash < 0 ? suffix : suffix.substring(0, dash));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** The {@code n} of {@code <id>_BRANCH_<millis>-n}; 0 when absent. */
    static int branchSequence(String directoryName) {
        int marker = directoryName.indexOf(BRANCH_MARKER);
        int dash = marker < 0 ? -1 : directoryName.indexOf('-', marker);
        if (dash < 0) return 0;
        try {
            return Integer.parseInt(directoryName.substring(dash + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static Instant parseInstant(String timestamp) {
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
