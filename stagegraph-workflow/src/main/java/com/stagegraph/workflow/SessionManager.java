package com.stagegraph.workflow;

import com.stagegraph.store.ArtifactStore;
import com.stagegraph.store.ArtifactStoreException;
import com.stagegraph.store.CreateResult;
import com.stagegraph.store.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Creates and finds sessions under {@code <basePath>/<persona>/}. Each session is a directory
 * {@code session-<millis>-<random>} holding {@code session.json}; the stage tree grows beside it.
 */
public final class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    public static final String METADATA_FILE = "session.json";
    static final String SESSION_PREFIX = "session-";
    private static final int MAX_CREATE_ATTEMPTS = 16;

    private final ArtifactStore store;
    private final String basePath;
    private final Clock clock;

    public SessionManager(ArtifactStore store, String basePath, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.basePath = Objects.requireNonNull(basePath, "basePath");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SessionManager(ArtifactStore store, String basePath) {
        this(store, basePath, Clock.systemUTC());
    }

    /**
     * Starts a new session for {@code persona}. The id is retried on the unlikely collision with
     * an existing directory.
     *
     * @throws ArtifactStoreException if the store fails, or no free id was found
     */
    public Session create(String persona, String manifestVersion) {
        Objects.requireNonNull(persona, "persona");
        Instant now = clock.instant();
        for (int attempt = 0; attempt < MAX_CREATE_ATTEMPTS; attempt++) {
            String id = SESSION_PREFIX + now.toEpochMilli() + "-" + randomSuffix();
            String root = sessionRoot(persona, id);
            Session session = new Session(id, persona, manifestVersion, now.toString(), now.toString(), root);
            if (store.createAtomically(StorePaths.join(root, METADATA_FILE), session.toJsonBytes()) == CreateResult.CREATED) {
                log.info("Created session id={} persona={} root={}", id, persona, root);
                return session;
            }
            log.debug("Session id={} already exists, retrying", id);
        }
        throw new ArtifactStoreException(StorePaths.join(basePath, persona),
                "no free session id after " + MAX_CREATE_ATTEMPTS + " attempts");
    }

    /** The session, or null when it does not exist or its metadata is unreadable. */
    public Session resume(String persona, String sessionId) {
        String root = sessionRoot(persona, sessionId);
        byte[] bytes = store.read(StorePaths.join(root, METADATA_FILE));
        if (bytes == null) {
            log.info("No session id={} for persona={}", sessionId, persona);
            return null;
        }
        try {
            Session session = Session.fromJson(bytes).withRoot(root);
            log.info("Resumed session id={} persona={}", sessionId, persona);
            return session;
        } catch (UncheckedIOException e) {
            log.warn("Cannot resume session id={}: {}", sessionId, e.getMessage());
            return null;
        }
    }

    /** Sessions of {@code persona}, newest first. Directories without readable metadata are skipped. */
    public List<Session> list(String persona) {
        List<Session> sessions = new ArrayList<>();
        String personaDir = StorePaths.join(basePath, persona);
        for (String child : store.listChildren(personaDir)) {
            if (!child.startsWith(SESSION_PREFIX)) continue;
            String root = StorePaths.join(personaDir, child);
            byte[] bytes = store.read(StorePaths.join(root, METADATA_FILE));
            if (bytes == null) continue;
            try {
                sessions.add(Session.fromJson(bytes).withRoot(root));
            } catch (UncheckedIOException e) {
                log.warn("Skipping session dir={}: {}", root, e.getMessage());
            }
        }
        sessions.sort(Comparator.comparing(SessionManager::createdAt).thenComparing(Session::getId).reversed());
        return sessions;
    }

    /**
     * Creation instant from {@code created}, else from the millis in a {@code session-<millis>-...} id,
     * else the epoch.
     */
    static Instant createdAt(Session session) {
        if (session.getCreated() != null) {
            try {
                return Instant.parse(session.getCreated());
            } catch (DateTimeParseException e) {
                log.debug("Session id={} has unparsable created={}", session.getId(), session.getCreated());
            }
        }
        String id = session.getId();
        if (id.startsWith(SESSION_PREFIX)) {
            int dash = id.indexOf('-', SESSION_PREFIX.length());
            String millis = dash < 0 ? id.substring(SESSION_PREFIX.length()) : id.substring(SESSION_PREFIX.length(), dash);
            try {
                return Instant.ofEpochMilli(Long.parseLong(millis));
            } catch (NumberFormatException e) {
                log.debug("Session id={} carries no creation millis", id);
            }
        }
        return Instant.EPOCH;
    }

    public String sessionRoot(String persona, String sessionId) {
        return StorePaths.join(basePath, persona, sessionId);
    }

    public String getBasePath() {
        return basePath;
    }

    private static String randomSuffix() {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(36L * 36 * 36 * 36 * 36 * 36), 36);
        return "0".repeat(6 - suffix.length()) + suffix;
    }
}
