package com.usatiuk.gridblobs.client.streams;

import com.usatiuk.gridblobs.client.index.ObjectRecord;
import com.usatiuk.gridblobs.store.BlobId;
import com.usatiuk.gridblobs.store.BlobNotFoundException;
import com.usatiuk.gridblobs.store.ChunkedFileStore;
import io.quarkus.logging.Log;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Opens blobs for chunked reading and writing.
 */
@ApplicationScoped
public class ChunkStreams {
    @ConfigProperty(name = "gridblobs.chunk-size", defaultValue = "261120")
    int chunkSize;

    @Inject
    ChunkedFileStore store;

    void init(@Observes StartupEvent event) {
        if (chunkSize <= 0)
            throw new IllegalArgumentException("gridblobs.chunk-size should be positive: " + chunkSize);
        Log.infov("Using chunk size {0}", chunkSize);
    }

    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Open the chunks of a blob.
     *
     * @param id the blob identifier
     * @return stream of chunks in stored order, empty for an empty blob
     * @throws BlobNotFoundException if there is no such blob
     */
    public ChunkStream openRead(BlobId id) {
        var chunks = store.openDownloadStream(id);
        return new ChunkStream(ObjectRecord.of(chunks.file()), chunks);
    }

    /**
     * Start writing a new blob under a name.
     * A completed write becomes the live record for the name, previous records stay in the store.
     *
     * @param name the blob name
     * @return an open sink, to be completed or closed by the caller
     */
    public ChunkSink openWrite(String name) {
        return new ChunkSink(name, store.openUploadStream(name, chunkSize));
    }
}
