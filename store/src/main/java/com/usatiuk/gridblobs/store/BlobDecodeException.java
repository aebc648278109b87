package com.usatiuk.gridblobs.store;

/**
 * Thrown when stored bytes are not valid text in the expected encoding.
 */
public class BlobDecodeException extends BlobStoreException {
    public BlobDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
