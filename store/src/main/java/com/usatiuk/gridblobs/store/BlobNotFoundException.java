package com.usatiuk.gridblobs.store;

/**
 * Thrown when no live file matches a name or id.
 * Expected during normal lookups, so no stack trace is captured.
 */
public class BlobNotFoundException extends BlobStoreException {
    public BlobNotFoundException(String message) {
        super(message);
    }

    public static BlobNotFoundException forName(String name) {
        return new BlobNotFoundException("No file named " + name);
    }

    public static BlobNotFoundException forId(BlobId id) {
        return new BlobNotFoundException("No file with id " + id);
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
