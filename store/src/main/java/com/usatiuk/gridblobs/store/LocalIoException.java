package com.usatiuk.gridblobs.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when the local filesystem fails during a sync operation.
 * Kept apart from {@link RemoteStoreException} so callers can tell their disk from the store.
 */
public class LocalIoException extends BlobStoreException {
    private final Path _path;

    public LocalIoException(Path path, IOException cause) {
        super("Local I/O failed for " + path + ": " + cause.getMessage(), cause);
        _path = path;
    }

    public Path getPath() {
        return _path;
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
