package com.usatiuk.gridblobs.store.stores;

import com.usatiuk.gridblobs.store.BlobId;
import com.usatiuk.gridblobs.store.StoredFile;
import com.usatiuk.gridblobs.store.UploadSession;
import jakarta.annotation.Nullable;

/**
 * Keeps the bookkeeping shared by all upload sessions: open/closed state and the chunk size rules.
 */
abstract class BaseUploadSession implements UploadSession {
    protected final BlobId _id;
    protected final String _filename;
    protected final int _chunkSize;
    private long _length = 0;
    private long _chunks = 0;
    private boolean _sawShortChunk = false;
    private boolean _open = true;

    protected BaseUploadSession(BlobId id, String filename, int chunkSize) {
        if (chunkSize <= 0)
            throw new IllegalArgumentException("Chunk size should be positive: " + chunkSize);
        _id = id;
        _filename = filename;
        _chunkSize = chunkSize;
    }

    protected abstract void doWriteChunk(long n, byte[] chunk);

    protected abstract StoredFile doFinish(long length, @Nullable String checksum);

    protected abstract void doAbort();

    @Override
    public BlobId id() {
        return _id;
    }

    @Override
    public int chunkSize() {
        return _chunkSize;
    }

    protected long length() {
        return _length;
    }

    private void verifyOpen() {
        if (!_open) throw new IllegalStateException("Upload of " + _filename + " (" + _id + ") is closed");
    }

    @Override
    public void writeChunk(byte[] chunk) {
        verifyOpen();
        if (chunk.length == 0 || chunk.length > _chunkSize)
            throw new IllegalArgumentException("Chunk of " + chunk.length + " bytes, expected 1.." + _chunkSize);
        if (_sawShortChunk)
            throw new IllegalStateException("Chunk written after the last one for " + _id);
        doWriteChunk(_chunks, chunk);
        _chunks++;
        _length += chunk.length;
        if (chunk.length < _chunkSize)
            _sawShortChunk = true;
    }

    @Override
    public StoredFile finish(@Nullable String checksum) {
        verifyOpen();
        _open = false;
        try {
            return doFinish(_length, checksum);
        } catch (Throwable e) {
            try {
                doAbort();
            } catch (Throwable abortError) {
                e.addSuppressed(abortError);
            }
            throw e;
        }
    }

    @Override
    public void abort() {
        if (!_open) return;
        _open = false;
        doAbort();
    }

    @Override
    public boolean isOpen() {
        return _open;
    }
}
