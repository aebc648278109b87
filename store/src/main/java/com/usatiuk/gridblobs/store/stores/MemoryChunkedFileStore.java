package com.usatiuk.gridblobs.store.stores;

import com.usatiuk.gridblobs.store.*;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.logging.Log;
import jakarta.annotation.Nullable;
import jakarta.enterprise.context.ApplicationScoped;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Chunked file store kept entirely in memory.
 * Readers work on an immutable snapshot of the maps, so a file and its chunks appear at once.
 */
@ApplicationScoped
@IfBuildProperty(name = "gridblobs.store.backend", stringValue = "memory")
public class MemoryChunkedFileStore implements ChunkedFileStore {
    // In publish order
    private PVector<StoredFile> _files = TreePVector.empty();
    private PMap<BlobId, StoredFile> _filesById = HashTreePMap.empty();
    private PMap<BlobId, PVector<byte[]>> _chunks = HashTreePMap.empty();
    // Upload dates never go back in publish order
    private Instant _lastUploadDate = Instant.EPOCH;

    @Override
    public List<StoredFile> findByName(String filename) {
        PVector<StoredFile> files;
        synchronized (this) {
            files = _files;
        }
        var found = new ArrayList<StoredFile>();
        for (int i = files.size() - 1; i >= 0; i--) {
            var f = files.get(i);
            if (f.filename().equals(filename))
                found.add(f);
        }
        // Stable sort, later published files stay first on equal dates
        found.sort(Comparator.comparing(StoredFile::uploadDate).reversed());
        return List.copyOf(found);
    }

    @Override
    public Optional<StoredFile> findById(BlobId id) {
        synchronized (this) {
            return Optional.ofNullable(_filesById.get(id));
        }
    }

    @Override
    public ChunkIterator openDownloadStream(BlobId id) {
        StoredFile file;
        PVector<byte[]> chunks;
        synchronized (this) {
            file = _filesById.get(id);
            chunks = _chunks.get(id);
        }
        if (file == null || chunks == null)
            throw BlobNotFoundException.forId(id);
        return new ChunkIterator() {
            private int _next = 0;
            private boolean _closed = false;

            @Override
            public StoredFile file() {
                return file;
            }

            @Override
            public boolean hasNext() {
                return !_closed && _next < chunks.size();
            }

            @Override
            public byte[] next() {
                if (!hasNext()) throw new NoSuchElementException();
                return chunks.get(_next++).clone();
            }

            @Override
            public void close() {
                _closed = true;
            }
        };
    }

    @Override
    public UploadSession openUploadStream(String filename, int chunkSize) {
        return new MemoryUploadSession(BlobId.random(), filename, chunkSize);
    }

    private class MemoryUploadSession extends BaseUploadSession {
        private PVector<byte[]> _written = TreePVector.empty();

        private MemoryUploadSession(BlobId id, String filename, int chunkSize) {
            super(id, filename, chunkSize);
        }

        @Override
        protected void doWriteChunk(long n, byte[] chunk) {
            _written = _written.plus(chunk.clone());
        }

        @Override
        protected StoredFile doFinish(long length, @Nullable String checksum) {
            StoredFile file;
            synchronized (MemoryChunkedFileStore.this) {
                var now = Instant.now();
                if (now.isBefore(_lastUploadDate)) now = _lastUploadDate;
                _lastUploadDate = now;
                file = new StoredFile(_id, _filename, length, _chunkSize, now, checksum);
                _chunks = _chunks.plus(_id, _written);
                _filesById = _filesById.plus(_id, file);
                _files = _files.plus(file);
            }
            Log.debugv("Published {0} as {1} ({2} bytes)", _filename, _id, length);
            return file;
        }

        @Override
        protected void doAbort() {
            Log.debugv("Discarding upload of {0} ({1}), {2} bytes written", _filename, _id, length());
            _written = TreePVector.empty();
        }
    }
}
