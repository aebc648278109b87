package com.usatiuk.gridblobs.client.index;

import com.usatiuk.gridblobs.store.BlobId;
import com.usatiuk.gridblobs.store.BlobNotFoundException;
import com.usatiuk.gridblobs.store.ChunkedFileStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Maps blob names to identifiers and metadata.
 * <p>
 * The store does not keep names unique. When several records share a name,
 * the most recently published one is the live record for that name.
 */
@ApplicationScoped
public class MetadataIndex {
    @Inject
    ChunkedFileStore store;

    /**
     * Resolve a name to the identifier of its live record.
     *
     * @param name the blob name
     * @return the identifier of the most recently published record with this name
     * @throws BlobNotFoundException if nothing was published under this name
     */
    public BlobId resolve(String name) {
        var found = store.findByName(name);
        if (found.isEmpty())
            throw BlobNotFoundException.forName(name);
        return found.get(0).id();
    }

    /**
     * Get the record of a blob.
     *
     * @param id the blob identifier
     * @return its record
     * @throws BlobNotFoundException if there is no such blob
     */
    public ObjectRecord describe(BlobId id) {
        return store.findById(id).map(ObjectRecord::of).orElseThrow(() -> BlobNotFoundException.forId(id));
    }

    /**
     * Get the live record of a name.
     *
     * @param name the blob name
     * @return the most recently published record with this name
     * @throws BlobNotFoundException if nothing was published under this name
     */
    public ObjectRecord describe(String name) {
        var found = store.findByName(name);
        if (found.isEmpty())
            throw BlobNotFoundException.forName(name);
        return ObjectRecord.of(found.get(0));
    }

    /**
     * Check whether anything was published under a name.
     * A missing name is not an error here, only store failures are thrown.
     *
     * @param name the blob name
     * @return true if a record with this name exists
     */
    public boolean exists(String name) {
        return !store.findByName(name).isEmpty();
    }

    /**
     * All records ever published under a name and not yet removed.
     *
     * @param name the blob name
     * @return the records, most recent first, possibly empty
     */
    public List<ObjectRecord> revisions(String name) {
        return store.findByName(name).stream().map(ObjectRecord::of).toList();
    }
}
