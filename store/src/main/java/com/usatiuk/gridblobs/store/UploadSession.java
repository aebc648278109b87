package com.usatiuk.gridblobs.store;

import jakarta.annotation.Nullable;

/**
 * An open upload of one file.
 * Chunks are stored as they are written, but the file only becomes visible once {@link #finish(String)} returns.
 * Closing a session that wasn't finished aborts it.
 */
public interface UploadSession extends AutoCloseable {
    /**
     * Identifier the file will be published under.
     *
     * @return the id
     */
    BlobId id();

    /**
     * Chunk size of this upload; every chunk but the last must be exactly this long.
     *
     * @return the chunk size in bytes
     */
    int chunkSize();

    /**
     * Store the next chunk.
     *
     * @param chunk chunk bytes, 1 to {@link #chunkSize()} long
     * @throws IllegalStateException if a short chunk was already written, or the session is closed
     */
    void writeChunk(byte[] chunk);

    /**
     * Publish the file.
     *
     * @param checksum hex SHA-256 of the content, or null
     * @return the published metadata
     */
    StoredFile finish(@Nullable String checksum);

    /**
     * Discard everything written so far. Does nothing if the session is already finished or aborted.
     */
    void abort();

    boolean isOpen();

    @Override
    default void close() {
        if (isOpen())
            abort();
    }
}
