package com.usatiuk.gridblobs.client.sync;

import com.usatiuk.gridblobs.client.index.MetadataIndex;
import com.usatiuk.gridblobs.client.streams.ChunkStreams;
import com.usatiuk.gridblobs.store.BlobId;
import com.usatiuk.gridblobs.store.LocalIoException;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Copies blobs between the store and local files, one chunk at a time.
 */
@ApplicationScoped
public class LocalSync {
    @Inject
    MetadataIndex metadataIndex;
    @Inject
    ChunkStreams chunkStreams;

    public BlobId downloadTo(String name, Path path) {
        return downloadTo(metadataIndex.resolve(name), path);
    }

    /**
     * Download a blob into a local file, replacing it if it exists.
     * The blob is opened before anything is created, so an unknown blob leaves the target alone.
     * Chunks are written to a temporary file next to the target, which is moved over it once
     * the download is complete. On failure the temporary file is deleted and the target is unchanged.
     *
     * @param id   the blob identifier
     * @param path file to write
     * @return the identifier of the downloaded blob
     */
    public BlobId downloadTo(BlobId id, Path path) {
        try (var chunks = chunkStreams.openRead(id)) {
            Path tmp;
            try {
                tmp = Files.createTempFile(path.toAbsolutePath().getParent(), "." + path.getFileName(), ".part");
            } catch (IOException e) {
                throw new LocalIoException(path, e);
            }
            try {
                try (var out = new BufferedOutputStream(Files.newOutputStream(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING))) {
                    chunks.transferTo(out);
                }
                moveIntoPlace(tmp, path);
                Log.debugv("Downloaded {0} to {1}", id, path);
                return id;
            } catch (IOException e) {
                deletePartial(tmp, e);
                throw new LocalIoException(path, e);
            } catch (RuntimeException | Error e) {
                deletePartial(tmp, e);
                throw e;
            }
        }
    }

    private static void moveIntoPlace(Path tmp, Path path) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deletePartial(Path tmp, Throwable cause) {
        try {
            Files.deleteIfExists(tmp);
            Log.debugv("Deleted partial download {0}", tmp);
        } catch (IOException e) {
            Log.error("Failed to delete partial download " + tmp, e);
            cause.addSuppressed(e);
        }
    }

    /**
     * Upload a local file as a new blob.
     * Nothing is published if reading the file or writing to the store fails.
     *
     * @param name the blob name
     * @param path file to read
     * @return the identifier of the new blob
     * @throws LocalIoException if reading the file fails
     */
    public BlobId uploadFrom(String name, Path path) {
        try (var in = Files.newInputStream(path);
             var sink = chunkStreams.openWrite(name)) {
            var buf = new byte[chunkStreams.chunkSize()];
            int read;
            while ((read = in.read(buf)) != -1) {
                sink.write(buf, 0, read);
            }
            var record = sink.complete();
            Log.debugv("Uploaded {0} as {1}", path, record.id());
            return record.id();
        } catch (IOException e) {
            Log.error("Failed reading " + path, e);
            throw new LocalIoException(path, e);
        }
    }
}
