package com.usatiuk.gridblobs.store;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * BlobId is the opaque identifier of a stored blob.
 * It is assigned by the store when an upload is opened and never changes afterwards.
 *
 * @param value the store-native textual form of the id
 */
public record BlobId(String value) implements Serializable, Comparable<BlobId> {
    public BlobId {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty())
            throw new IllegalArgumentException("Blob id can't be empty");
    }

    /**
     * Creates a new BlobId from a string value.
     *
     * @param value the string value of the id
     * @return a new BlobId
     */
    public static BlobId of(String value) {
        return new BlobId(value);
    }

    /**
     * Creates a new BlobId with a random UUID.
     *
     * @return a new BlobId with a random UUID
     */
    public static BlobId random() {
        return new BlobId(UUID.randomUUID().toString());
    }

    @Override
    public int compareTo(BlobId o) {
        return value.compareTo(o.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
