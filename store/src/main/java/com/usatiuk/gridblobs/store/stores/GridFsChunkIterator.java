package com.usatiuk.gridblobs.store.stores;

import com.mongodb.MongoException;
import com.usatiuk.gridblobs.store.ChunkIterator;
import com.usatiuk.gridblobs.store.RemoteStoreException;
import com.usatiuk.gridblobs.store.StoredFile;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Splits a download stream back into chunks of the file's chunk size.
 * Each chunk is read lazily when asked for; the stream is closed once exhausted or on {@link #close()}.
 */
public class GridFsChunkIterator implements ChunkIterator {
    private final StoredFile _file;
    private final InputStream _stream;
    private long _remaining;
    private boolean _closed = false;

    public GridFsChunkIterator(StoredFile file, InputStream stream) {
        _file = file;
        _stream = stream;
        _remaining = file.length();
    }

    @Override
    public StoredFile file() {
        return _file;
    }

    @Override
    public boolean hasNext() {
        return !_closed && _remaining > 0;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) throw new NoSuchElementException();

        var buf = new byte[(int) Math.min(_file.chunkSize(), _remaining)];
        int read;
        try {
            read = IOUtils.read(_stream, buf);
        } catch (IOException | MongoException e) {
            close();
            throw new RemoteStoreException("Failed reading chunks of " + _file.id(), e);
        }
        if (read == 0) {
            close();
            throw new RemoteStoreException("Chunks of " + _file.id() + " end " + _remaining + " bytes early");
        }
        _remaining -= read;
        if (_remaining == 0)
            close();
        return read == buf.length ? buf : Arrays.copyOf(buf, read);
    }

    @Override
    public void close() {
        if (_closed) return;
        _closed = true;
        try {
            _stream.close();
        } catch (IOException | MongoException e) {
            throw new RemoteStoreException("Failed closing download of " + _file.id(), e);
        }
    }
}
