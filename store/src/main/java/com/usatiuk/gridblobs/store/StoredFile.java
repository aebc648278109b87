package com.usatiuk.gridblobs.store;

import jakarta.annotation.Nullable;

import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;

/**
 * Metadata document of a completely uploaded file, as kept by the store.
 *
 * @param id         identifier of the file
 * @param filename   name the file was uploaded under
 * @param length     total content length in bytes
 * @param chunkSize  size of every chunk except possibly the last one
 * @param uploadDate time the upload was published
 * @param checksum   hex SHA-256 of the content, null if the uploader didn't record one
 */
public record StoredFile(BlobId id, String filename, long length, int chunkSize, Instant uploadDate,
                         @Nullable String checksum) implements Serializable {
    public Optional<String> checksumOpt() {
        return Optional.ofNullable(checksum);
    }

    /**
     * Number of chunks the content is split into.
     *
     * @return chunk count, 0 for empty content
     */
    public long chunkCount() {
        if (length == 0) return 0;
        return (length + chunkSize - 1) / chunkSize;
    }

    public StoredFile withChecksum(String checksum) {
        return new StoredFile(id, filename, length, chunkSize, uploadDate, checksum);
    }
}
