package com.stagegraph.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory store. Only files are stored; a directory exists as long as some file
 * lives below it. Atomic create is {@link ConcurrentHashMap#putIfAbsent}.
 */
public final class InMemoryArtifactStore implements ArtifactStore {

    private final Map<String, byte[]> files = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String path) {
        String key = StorePaths.normalize(path);
        if (files.containsKey(key)) return true;
        String prefix = key.isEmpty() ? "" : key + "/";
        for (String file : files.keySet()) {
            if (file.startsWith(prefix)) return true;
        }
        return false;
    }

    @Override
    public byte[] read(String path) {
        byte[] bytes = files.get(StorePaths.normalize(path));
        return bytes != null ? bytes.clone() : null;
    }

    @Override
    public CreateResult createAtomically(String path, byte[] bytes) {
        String key = StorePaths.normalize(path);
        if (key.isEmpty()) {
            throw new ArtifactStoreException(path, "cannot create a file at the store root");
        }
        byte[] previous = files.putIfAbsent(key, bytes.clone());
        return previous == null ? CreateResult.CREATED : CreateResult.ALREADY_EXISTS;
    }

    @Override
    public List<String> listChildren(String path) {
        String key = StorePaths.normalize(path);
        String prefix = key.isEmpty() ? "" : key + "/";
        TreeSet<String> children = new TreeSet<>();
        for (String file : files.keySet()) {
            if (!file.startsWith(prefix)) continue;
            String rest = file.substring(prefix.length());
            int slash = rest.indexOf('/');
            children.add(slash < 0 ? rest : rest.substring(0, slash));
        }
        return new ArrayList<>(children);
    }

    /** Number of stored files. */
    public int size() {
        return files.size();
    }
}
