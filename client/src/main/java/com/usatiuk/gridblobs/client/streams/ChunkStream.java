package com.usatiuk.gridblobs.client.streams;

import com.usatiuk.gridblobs.client.index.ObjectRecord;
import com.usatiuk.gridblobs.store.ChunkIterator;
import com.usatiuk.gridblobs.store.RemoteStoreException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.security.MessageDigest;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Chunks of one blob in stored order.
 * <p>
 * The sequence is lazy and can be consumed once; open a new stream to read again.
 * When the last chunk is consumed the total length, and the checksum if the record has one,
 * are verified against the record.
 */
public class ChunkStream implements Iterator<byte[]>, AutoCloseable {
    private final ObjectRecord _record;
    private final ChunkIterator _chunks;
    private final MessageDigest _digest = DigestUtils.getSha256Digest();
    private long _read = 0;
    private boolean _verified = false;

    ChunkStream(ObjectRecord record, ChunkIterator chunks) {
        _record = record;
        _chunks = chunks;
    }

    public ObjectRecord record() {
        return _record;
    }

    @Override
    public boolean hasNext() {
        if (_chunks.hasNext())
            return true;
        verify();
        return false;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) throw new NoSuchElementException();
        var chunk = _chunks.next();
        _read += chunk.length;
        _digest.update(chunk);
        if (_read > _record.length())
            throw new RemoteStoreException("Blob " + _record.id() + " has more than the recorded " + _record.length() + " bytes");
        return chunk;
    }

    private void verify() {
        if (_verified) return;
        _verified = true;
        if (_read != _record.length())
            throw new RemoteStoreException("Blob " + _record.id() + " ended after " + _read + " of " + _record.length() + " bytes");
        if (_record.checksum() != null) {
            var actual = Hex.encodeHexString(_digest.digest());
            if (!actual.equalsIgnoreCase(_record.checksum()))
                throw new RemoteStoreException("Checksum mismatch for blob " + _record.id() + ": expected " + _record.checksum() + ", got " + actual);
        }
    }

    /**
     * Write all remaining chunks to the output, one at a time.
     *
     * @param out where to write
     * @return number of bytes written
     * @throws IOException if writing to the output fails
     */
    public long transferTo(OutputStream out) throws IOException {
        long written = 0;
        while (hasNext()) {
            var chunk = next();
            out.write(chunk);
            written += chunk.length;
        }
        return written;
    }

    @Override
    public void close() {
        _chunks.close();
    }
}
