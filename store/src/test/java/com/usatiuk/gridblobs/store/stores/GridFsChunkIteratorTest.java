package com.usatiuk.gridblobs.store.stores;

import com.usatiuk.gridblobs.store.BlobId;
import com.usatiuk.gridblobs.store.RemoteStoreException;
import com.usatiuk.gridblobs.store.StoredFile;
import org.bson.BsonInt32;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.NoSuchElementException;

public class GridFsChunkIteratorTest {
    private static class TrackingStream extends ByteArrayInputStream {
        boolean closed = false;

        TrackingStream(byte[] buf) {
            super(buf);
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    private static StoredFile file(long length, int chunkSize) {
        return new StoredFile(BlobId.of("test"), "test", length, chunkSize, Instant.now(), null);
    }

    private static byte[] bytes(int n) {
        var ret = new byte[n];
        for (int i = 0; i < n; i++) ret[i] = (byte) i;
        return ret;
    }

    @Test
    void splitsIntoChunks() {
        var stream = new TrackingStream(bytes(10));
        var chunks = new ArrayList<byte[]>();
        try (var it = new GridFsChunkIterator(file(10, 4), stream)) {
            while (it.hasNext())
                chunks.add(it.next());
            Assertions.assertThrows(NoSuchElementException.class, it::next);
        }
        Assertions.assertEquals(3, chunks.size());
        Assertions.assertArrayEquals(new byte[]{0, 1, 2, 3}, chunks.get(0));
        Assertions.assertArrayEquals(new byte[]{4, 5, 6, 7}, chunks.get(1));
        Assertions.assertArrayEquals(new byte[]{8, 9}, chunks.get(2));
        Assertions.assertTrue(stream.closed);
    }

    @Test
    void fillsChunksFromShortReads() {
        var data = bytes(9);
        // Hands out at most 2 bytes per read call
        InputStream trickle = new ByteArrayInputStream(data) {
            @Override
            public synchronized int read(byte[] b, int off, int len) {
                return super.read(b, off, Math.min(len, 2));
            }
        };
        try (var it = new GridFsChunkIterator(file(9, 5), trickle)) {
            Assertions.assertArrayEquals(new byte[]{0, 1, 2, 3, 4}, it.next());
            Assertions.assertArrayEquals(new byte[]{5, 6, 7, 8}, it.next());
            Assertions.assertFalse(it.hasNext());
        }
    }

    @Test
    void emptyFileHasNoChunks() {
        var stream = new TrackingStream(new byte[0]);
        try (var it = new GridFsChunkIterator(file(0, 4), stream)) {
            Assertions.assertFalse(it.hasNext());
        }
        Assertions.assertTrue(stream.closed);
    }

    @Test
    void truncatedStreamFails() {
        var stream = new TrackingStream(bytes(4));
        try (var it = new GridFsChunkIterator(file(10, 4), stream)) {
            Assertions.assertEquals(4, it.next().length);
            Assertions.assertThrows(RemoteStoreException.class, it::next);
            Assertions.assertFalse(it.hasNext());
        }
        Assertions.assertTrue(stream.closed);
    }

    @Test
    void readErrorBecomesRemoteError() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };
        try (var it = new GridFsChunkIterator(file(10, 4), broken)) {
            var e = Assertions.assertThrows(RemoteStoreException.class, it::next);
            Assertions.assertInstanceOf(IOException.class, e.getCause());
        }
    }

    @Test
    void closeStopsIteration() {
        var stream = new TrackingStream(bytes(10));
        var it = new GridFsChunkIterator(file(10, 4), stream);
        it.next();
        it.close();
        Assertions.assertFalse(it.hasNext());
        Assertions.assertTrue(stream.closed);
    }

    @Test
    void idConversion() {
        var oid = new ObjectId();
        var id = GridFsChunkedFileStore.fromBson(new BsonObjectId(oid));
        Assertions.assertEquals(oid.toHexString(), id.value());
        Assertions.assertEquals(new BsonObjectId(oid), GridFsChunkedFileStore.toBson(id));

        var custom = GridFsChunkedFileStore.fromBson(new BsonString("custom-id"));
        Assertions.assertEquals(new BsonString("custom-id"), GridFsChunkedFileStore.toBson(custom));

        Assertions.assertThrows(RemoteStoreException.class, () -> GridFsChunkedFileStore.fromBson(new BsonInt32(5)));
    }
}
