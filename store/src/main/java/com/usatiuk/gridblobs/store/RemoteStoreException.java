package com.usatiuk.gridblobs.store;

/**
 * Thrown when the underlying store or the connection to it fails.
 * Not retried here.
 */
public class RemoteStoreException extends BlobStoreException {
    public RemoteStoreException(String message) {
        super(message);
    }

    public RemoteStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
