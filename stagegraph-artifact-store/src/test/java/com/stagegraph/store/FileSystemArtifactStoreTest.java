package com.stagegraph.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemArtifactStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void createAtomically_writesOnceAndCreatesParents() throws Exception {
        FileSystemArtifactStore store = new FileSystemArtifactStore(tempDir);
        byte[] first = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);

        assertEquals(CreateResult.CREATED, store.createAtomically("sess/search/meta/search.json", first));
        assertEquals(CreateResult.ALREADY_EXISTS,
                store.createAtomically("sess/search/meta/search.json", "{}".getBytes(StandardCharsets.UTF_8)));

        Path onDisk = tempDir.resolve("sess/search/meta/search.json");
        assertTrue(Files.isRegularFile(onDisk));
        assertArrayEquals(first, Files.readAllBytes(onDisk));
        assertArrayEquals(first, store.read("sess/search/meta/search.json"));
    }

    @Test
    void listChildren_hidesTempFilesAndSortsNames() throws Exception {
        FileSystemArtifactStore store = new FileSystemArtifactStore(tempDir);
        store.createAtomically("sess/b/meta/b.json", new byte[]{1});
        store.createAtomically("sess/a/meta/a.json", new byte[]{2});
        Files.writeString(tempDir.resolve("sess/a/meta/.stagegraph-123.part"), "partial");

        assertEquals(List.of("a", "b"), store.listChildren("sess"));
        assertEquals(List.of("a.json"), store.listChildren("sess/a/meta"));
        assertEquals(List.of(), store.listChildren("sess/missing"));
    }

    @Test
    void readAndExists_handleMissingEntries() {
        FileSystemArtifactStore store = new FileSystemArtifactStore(tempDir);

        assertFalse(store.exists("nope"));
        assertNull(store.read("nope/file.json"));
        assertTrue(store.exists(""));
    }

    @Test
    void paths_cannotEscapeBaseDirectory() {
        FileSystemArtifactStore store = new FileSystemArtifactStore(tempDir.resolve("base"));

        ArtifactStoreException e = assertThrows(ArtifactStoreException.class,
                () -> store.createAtomically("../outside.json", new byte[]{1}));
        assertEquals("../outside.json", e.getPath());
        assertFalse(Files.exists(tempDir.resolve("outside.json")));
    }

    @Test
    void createAtomically_failsWhenParentIsAFile() throws Exception {
        FileSystemArtifactStore store = new FileSystemArtifactStore(tempDir);
        Files.writeString(tempDir.resolve("blocker"), "x");

        assertThrows(ArtifactStoreException.class, () -> store.createAtomically("blocker/meta/a.json", new byte[]{1}));
    }
}
