package com.usatiuk.gridblobs.store;

import java.util.Iterator;

/**
 * An iterator over the chunks of one stored file, in sequence order.
 * It holds store resources and must be closed.
 */
public interface ChunkIterator extends Iterator<byte[]>, AutoCloseable {
    /**
     * Metadata of the file being read.
     *
     * @return the file metadata
     */
    StoredFile file();

    @Override
    void close();
}
