package com.usatiuk.gridblobs.store;

/**
 * Base class of all errors raised by the blob store and the client built on it.
 */
public abstract class BlobStoreException extends RuntimeException {
    protected BlobStoreException(String message) {
        super(message);
    }

    protected BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
