package com.stagegraph.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Store backed by a directory on the host filesystem. Store paths resolve below {@code baseDir};
 * a path that would escape it is rejected.
 * <p>
 * {@link #createAtomically} writes a temp file next to the target and hard-links it into place,
 * so readers never see a half-written file. Where hard links are not supported it falls back to
 * {@link StandardOpenOption#CREATE_NEW}.
 */
public final class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private static final String TEMP_PREFIX = ".stagegraph-";
    private static final String TEMP_SUFFIX = ".part";

    private final Path baseDir;

    public FileSystemArtifactStore(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public byte[] read(String path) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) return null;
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new ArtifactStoreException(path, e);
        }
    }

    @Override
    public CreateResult createAtomically(String path, byte[] bytes) {
        Path target = resolve(path);
        if (target.equals(baseDir)) {
            throw new ArtifactStoreException(path, "cannot create a file at the store root");
        }
        try {
            Files.createDirectories(target.getParent());
        } catch (IOException e) {
            throw new ArtifactStoreException(path, e);
        }
        if (Files.exists(target)) return CreateResult.ALREADY_EXISTS;

        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), TEMP_PREFIX, TEMP_SUFFIX);
            Files.write(temp, bytes);
            try {
                Files.createLink(target, temp);
            } catch (UnsupportedOperationException e) {
                log.debug("Hard links unsupported under {}, writing {} with CREATE_NEW", baseDir, path);
                Files.write(target, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            }
            log.debug("Created {} ({} bytes)", path, bytes.length);
            return CreateResult.CREATED;
        } catch (FileAlreadyExistsException e) {
            return CreateResult.ALREADY_EXISTS;
        } catch (IOException e) {
            throw new ArtifactStoreException(path, e);
        } finally {
            deleteTemp(temp);
        }
    }

    @Override
    public List<String> listChildren(String path) {
        Path dir = resolve(path);
        if (!Files.isDirectory(dir)) return List.of();
        List<String> names = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            entries.map(p -> p.getFileName().toString())
                    .filter(name -> !(name.startsWith(TEMP_PREFIX) && name.endsWith(TEMP_SUFFIX)))
                    .sorted()
                    .forEach(names::add);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new ArtifactStoreException(path, e);
        }
        return names;
    }

    private Path resolve(String path) {
        String normalized = StorePaths.normalize(path);
        Path resolved = normalized.isEmpty() ? baseDir : baseDir.resolve(normalized).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new ArtifactStoreException(path, "path escapes store base directory " + baseDir);
        }
        return resolved;
    }

    private void deleteTemp(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", temp, e.getMessage());
        }
    }
}
