package com.stagegraph.store;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryArtifactStoreTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void createAtomically_secondCreateReportsAlreadyExists() {
        InMemoryArtifactStore store = new InMemoryArtifactStore();

        assertEquals(CreateResult.CREATED, store.createAtomically("s1/search/meta/search.json", bytes("one")));
        assertEquals(CreateResult.ALREADY_EXISTS, store.createAtomically("s1/search/meta/search.json", bytes("two")));

        assertArrayEquals(bytes("one"), store.read("s1/search/meta/search.json"));
    }

    @Test
    void directoriesExistImplicitly() {
        InMemoryArtifactStore store = new InMemoryArtifactStore();
        store.createAtomically("s1/search/meta/search.json", bytes("{}"));
        store.createAtomically("s1/search_BRANCH_1/meta/search.json", bytes("{}"));
        store.createAtomically("s1/search/gather/meta/gather.json", bytes("{}"));

        assertTrue(store.exists("s1"));
        assertTrue(store.exists("/s1/search/"));
        assertFalse(store.exists("s1/sea"));
        assertNull(store.read("s1/search"));
        assertEquals(List.of("search", "search_BRANCH_1"), store.listChildren("s1"));
        assertEquals(List.of("gather", "meta"), store.listChildren("s1/search"));
        assertEquals(List.of(), store.listChildren("nothing"));
        assertEquals(List.of("s1"), store.listChildren(""));
    }

    @Test
    void read_returnsCopy() {
        InMemoryArtifactStore store = new InMemoryArtifactStore();
        store.createAtomically("a.json", bytes("abc"));

        store.read("a.json")[0] = 'z';

        assertArrayEquals(bytes("abc"), store.read("a.json"));
    }

    @Test
    void createAtomically_exactlyOneConcurrentWriterWins() throws Exception {
        InMemoryArtifactStore store = new InMemoryArtifactStore();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<CreateResult>> results = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            String content = "writer-" + i;
            results.add(pool.submit(() -> store.createAtomically("race/meta/x.json", bytes(content))));
        }
        int created = 0;
        for (Future<CreateResult> f : results) {
            if (f.get() == CreateResult.CREATED) created++;
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, created);
        assertEquals(1, store.size());
    }

    @Test
    void storePaths_joinDropsEmptySegments() {
        assertEquals("sessions/a/b", StorePaths.join("sessions/", "/a", "", null, "b"));
        assertEquals("a/b/c.json", StorePaths.normalize("/a//b/c.json/"));
    }
}
