package com.usatiuk.gridblobs.client.streams;

import com.usatiuk.gridblobs.client.index.ObjectRecord;
import com.usatiuk.gridblobs.store.BlobId;
import com.usatiuk.gridblobs.store.UploadSession;
import io.quarkus.logging.Log;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.security.MessageDigest;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Write side of a blob.
 * <p>
 * Bytes are accepted in any portions and cut into store chunks; every full chunk is sent
 * to the store right away. Nothing is visible to readers until {@link #complete()} returns.
 * Closing without completing, a failure, or an interrupt of the writing thread discards the upload.
 */
public class ChunkSink implements AutoCloseable {
    private final UploadSession _session;
    private final String _name;
    private final byte[] _buffer;
    private final MessageDigest _digest = DigestUtils.getSha256Digest();
    private int _buffered = 0;

    ChunkSink(String name, UploadSession session) {
        _name = name;
        _session = session;
        _buffer = new byte[session.chunkSize()];
    }

    public BlobId id() {
        return _session.id();
    }

    public String name() {
        return _name;
    }

    public boolean isOpen() {
        return _session.isOpen();
    }

    private void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            Log.debugv("Write of {0} interrupted", _name);
            var e = new CancellationException("Write of " + _name + " was interrupted");
            abortAfter(e);
            throw e;
        }
    }

    public void write(byte[] data) {
        write(data, 0, data.length);
    }

    public void write(byte[] data, int off, int len) {
        Objects.checkFromIndexSize(off, len, data.length);
        if (!isOpen()) throw new IllegalStateException("Write of " + _name + " is closed");
        checkCancelled();
        try {
            while (len > 0) {
                int toCopy = Math.min(len, _buffer.length - _buffered);
                System.arraycopy(data, off, _buffer, _buffered, toCopy);
                _digest.update(data, off, toCopy);
                _buffered += toCopy;
                off += toCopy;
                len -= toCopy;
                if (_buffered == _buffer.length)
                    flushChunk();
            }
        } catch (Throwable e) {
            abortAfter(e);
            throw e;
        }
    }

    private void flushChunk() {
        if (_buffered == 0) return;
        var chunk = new byte[_buffered];
        System.arraycopy(_buffer, 0, chunk, 0, _buffered);
        _session.writeChunk(chunk);
        _buffered = 0;
    }

    /**
     * Flush the remaining bytes and publish the blob.
     *
     * @return record of the published blob
     */
    public ObjectRecord complete() {
        if (!isOpen()) throw new IllegalStateException("Write of " + _name + " is closed");
        checkCancelled();
        try {
            flushChunk();
        } catch (Throwable e) {
            abortAfter(e);
            throw e;
        }
        var file = _session.finish(Hex.encodeHexString(_digest.digest()));
        Log.debugv("Wrote {0} as {1} ({2} bytes)", _name, file.id(), file.length());
        return ObjectRecord.of(file);
    }

    /**
     * Discard the upload. Nothing written so far becomes visible.
     */
    public void abort() {
        _buffered = 0;
        _session.abort();
    }

    // Keeps the original failure, an abort error is only attached to it
    private void abortAfter(Throwable cause) {
        try {
            abort();
        } catch (Throwable e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public void close() {
        if (isOpen())
            abort();
    }
}
