package com.usatiuk.gridblobs.store;

import java.util.List;
import java.util.Optional;

/**
 * A GridFS-style store of files split into ordered chunks.
 * Implementations are expected to be thread-safe.
 */
public interface ChunkedFileStore {
    /**
     * Find all published files with the given name.
     *
     * @param filename the name to look for
     * @return matching files, most recently uploaded first
     * @throws RemoteStoreException if the store can't be queried
     */
    List<StoredFile> findByName(String filename);

    /**
     * Find a published file by its id.
     *
     * @param id the id to look for
     * @return the file metadata, or an empty optional if there is no such file
     * @throws RemoteStoreException if the store can't be queried
     */
    Optional<StoredFile> findById(BlobId id);

    /**
     * Open the chunks of a published file for reading.
     *
     * @param id the file id
     * @return an iterator over the file chunks
     * @throws BlobNotFoundException if there is no such file
     * @throws RemoteStoreException  if the store can't be read
     */
    ChunkIterator openDownloadStream(BlobId id);

    /**
     * Start uploading a new file.
     *
     * @param filename  the name to publish the file under
     * @param chunkSize the chunk size to split content into
     * @return an open upload session
     * @throws RemoteStoreException if the store can't be written
     */
    UploadSession openUploadStream(String filename, int chunkSize);
}
