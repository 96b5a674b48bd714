package com.stagegraph.workflow;

import com.stagegraph.store.ArtifactStore;
import com.stagegraph.store.ArtifactStoreException;
import com.stagegraph.store.CreateResult;
import com.stagegraph.store.InMemoryArtifactStore;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionManagerTest {

    private final InMemoryArtifactStore store = new InMemoryArtifactStore();

    private SessionManager managerAt(String instant) {
        return new SessionManager(store, "sessions", Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
    }

    @Test
    void create_writesMetadataUnderPersona() {
        Session session = managerAt("2026-03-01T09:00:00Z").create("fedml", "1.2");

        assertTrue(session.getId().matches("session-1772355600000-[0-9a-z]{6}"), session.getId());
        assertEquals("sessions/fedml/" + session.getId(), session.getRoot());
        assertEquals("2026-03-01T09:00:00Z", session.getCreated());
        assertEquals(session.getCreated(), session.getLastActive());

        String json = new String(store.read(session.getRoot() + "/session.json"), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"manifestVersion\" : \"1.2\""), json);
        assertFalse(json.contains("root"), json);
    }

    @Test
    void create_sameMillisecondGivesDistinctSessions() {
        SessionManager manager = managerAt("2026-03-01T09:00:00Z");

        Session first = manager.create("fedml", "1");
        Session second = manager.create("fedml", "1");

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, manager.list("fedml").size());
    }

    @Test
    void resume_readsExistingAndReturnsNullOtherwise() {
        SessionManager manager = managerAt("2026-03-01T09:00:00Z");
        Session created = manager.create("fedml", "1.2");

        Session resumed = manager.resume("fedml", created.getId());

        assertEquals(created, resumed);
        assertNull(manager.resume("fedml", "session-0-000000"));
        assertNull(manager.resume("chris", created.getId()));
    }

    @Test
    void resume_corruptMetadataReturnsNull() {
        store.createAtomically("sessions/fedml/session-5-abcdef/session.json", "{nope".getBytes(StandardCharsets.UTF_8));

        assertNull(managerAt("2026-03-01T09:00:00Z").resume("fedml", "session-5-abcdef"));
    }

    @Test
    void list_newestFirstSkippingForeignAndCorruptEntries() {
        Session older = managerAt("2026-03-01T09:00:00Z").create("fedml", "1");
        Session newer = managerAt("2026-03-02T09:00:00Z").create("fedml", "1");
        managerAt("2026-03-03T09:00:00Z").create("chris", "1");
        store.createAtomically("sessions/fedml/session-9-zzzzzz/session.json", "[]".getBytes(StandardCharsets.UTF_8));
        store.createAtomically("sessions/fedml/notes.txt", "x".getBytes(StandardCharsets.UTF_8));

        List<String> ids = managerAt("2026-03-04T09:00:00Z").list("fedml").stream()
                .map(Session::getId).collect(Collectors.toList());

        assertEquals(List.of(newer.getId(), older.getId()), ids);
        assertTrue(managerAt("2026-03-04T09:00:00Z").list("nobody").isEmpty());
    }

    @Test
    void list_ordersByInstantNotByTimestampText() {
        Session whole = managerAt("2026-03-01T09:00:00Z").create("fedml", "1");
        Session later = managerAt("2026-03-01T09:00:00.500Z").create("fedml", "1");

        List<String> ids = managerAt("2026-03-01T10:00:00Z").list("fedml").stream()
                .map(Session::getId).collect(Collectors.toList());

        assertEquals(List.of(later.getId(), whole.getId()), ids);
    }

    @Test
    void createdAt_fallsBackToIdMillis() {
        Session noCreated = new Session("session-1772355600500-abcdef", "fedml", "1", null, null);
        Session garbled = new Session("session-1772355600000-abcdef", "fedml", "1", "yesterday", null);

        assertEquals(Instant.parse("2026-03-01T09:00:00.500Z"), SessionManager.createdAt(noCreated));
        assertEquals(Instant.parse("2026-03-01T09:00:00Z"), SessionManager.createdAt(garbled));
        assertEquals(Instant.EPOCH, SessionManager.createdAt(new Session("imported", "fedml", "1", null, null)));
    }

    @Test
    void create_propagatesStoreFailure() {
        ArtifactStore failing = new ArtifactStore() {
            @Override
            public boolean exists(String path) {
                return false;
            }

            @Override
            public byte[] read(String path) {
                return null;
            }

            @Override
            public CreateResult createAtomically(String path, byte[] content) {
                throw new ArtifactStoreException(path, "disk full");
            }

            @Override
            public List<String> listChildren(String path) {
                return List.of();
            }
        };
        SessionManager manager = new SessionManager(failing, "sessions", Clock.systemUTC());

        assertThrows(ArtifactStoreException.class, () -> manager.create("fedml", "1"));
    }
}
