package com.stagegraph.store;

import java.io.IOException;
import java.io.UncheckedIOException;

/** I/O failure inside an {@link ArtifactStore}. Carries the store path that failed. */
public class ArtifactStoreException extends UncheckedIOException {

    private final String path;

    public ArtifactStoreException(String path, IOException cause) {
        super("Artifact store failure at '" + path + "': " + cause.getMessage(), cause);
        this.path = path;
    }

    public ArtifactStoreException(String path, String message) {
        this(path, new IOException(message));
    }

    public String getPath() {
        return path;
    }
}
