package com.usatiuk.gridblobs.client.index;

import com.usatiuk.gridblobs.store.BlobId;
import com.usatiuk.gridblobs.store.StoredFile;
import jakarta.annotation.Nullable;

import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;

/**
 * ObjectRecord describes one completely written blob. Records are never changed,
 * writing the same name again creates a new record.
 *
 * @param id       blob identifier
 * @param name     name the blob was written under
 * @param length   content length in bytes
 * @param checksum hex SHA-256 of the content, null if unknown
 * @param created  time the blob was published
 */
public record ObjectRecord(BlobId id, String name, long length, @Nullable String checksum,
                           Instant created) implements Serializable {
    public static ObjectRecord of(StoredFile file) {
        return new ObjectRecord(file.id(), file.filename(), file.length(), file.checksum(), file.uploadDate());
    }

    public Optional<String> checksumOpt() {
        return Optional.ofNullable(checksum);
    }
}
