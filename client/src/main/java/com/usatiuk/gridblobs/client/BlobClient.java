package com.usatiuk.gridblobs.client;

import com.usatiuk.gridblobs.client.index.MetadataIndex;
import com.usatiuk.gridblobs.client.index.ObjectRecord;
import com.usatiuk.gridblobs.client.streams.ChunkStreams;
import com.usatiuk.gridblobs.store.BlobDecodeException;
import com.usatiuk.gridblobs.store.BlobId;
import com.usatiuk.gridblobs.store.BlobNotFoundException;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads and writes whole blobs by name or identifier.
 * Nothing is cached locally, every call goes to the store.
 */
@ApplicationScoped
public class BlobClient {
    @Inject
    MetadataIndex metadataIndex;
    @Inject
    ChunkStreams chunkStreams;

    public BlobId id(String name) {
        return metadataIndex.resolve(name);
    }

    public boolean exists(String name) {
        return metadataIndex.exists(name);
    }

    public ObjectRecord describe(String name) {
        return metadataIndex.describe(name);
    }

    public ObjectRecord describe(BlobId id) {
        return metadataIndex.describe(id);
    }

    public List<ObjectRecord> revisions(String name) {
        return metadataIndex.revisions(name);
    }

    /**
     * Read the whole content of the live record for a name.
     *
     * @param name the blob name
     * @return the content, possibly empty
     * @throws BlobNotFoundException if nothing was published under this name
     */
    public byte[] readBytes(String name) {
        return readBytes(metadataIndex.resolve(name));
    }

    public byte[] readBytes(BlobId id) {
        try (var chunks = chunkStreams.openRead(id)) {
            var length = chunks.record().length();
            if (length > Integer.MAX_VALUE - 8)
                throw new IllegalArgumentException("Blob " + id + " is too large to read into memory: " + length);
            var out = new byte[(int) length];
            int pos = 0;
            while (chunks.hasNext()) {
                var chunk = chunks.next();
                System.arraycopy(chunk, 0, out, pos, chunk.length);
                pos += chunk.length;
            }
            return out;
        }
    }

    public String readText(String name) {
        return readText(metadataIndex.resolve(name));
    }

    /**
     * Read a blob as UTF-8 text.
     *
     * @param id the blob identifier
     * @return decoded content
     * @throws BlobDecodeException if the content is not valid UTF-8
     */
    public String readText(BlobId id) {
        var bytes = readBytes(id);
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new BlobDecodeException("Blob " + id + " is not valid UTF-8", e);
        }
    }

    /**
     * Write a new blob under a name. Earlier records with the same name are kept,
     * the new one becomes the live record.
     *
     * @param name  the blob name
     * @param bytes content
     * @return record of the written blob
     */
    public ObjectRecord writeBytes(String name, byte[] bytes) {
        try (var sink = chunkStreams.openWrite(name)) {
            sink.write(bytes);
            return sink.complete();
        }
    }

    public ObjectRecord writeText(String name, String text) {
        return writeBytes(name, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Write a new blob from a stream, reading it one chunk at a time.
     * The stream is not closed.
     *
     * @param name the blob name
     * @param in   content source
     * @return record of the written blob
     * @throws IOException if reading from the stream fails, the upload is discarded
     */
    public ObjectRecord writeFrom(String name, InputStream in) throws IOException {
        try (var sink = chunkStreams.openWrite(name)) {
            var buf = new byte[chunkStreams.chunkSize()];
            int read;
            while ((read = in.read(buf)) != -1) {
                sink.write(buf, 0, read);
            }
            return sink.complete();
        } catch (IOException e) {
            Log.error("Failed reading content for " + name, e);
            throw e;
        }
    }
}
