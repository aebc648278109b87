package com.usatiuk.gridblobs.client;

import com.usatiuk.gridblobs.store.*;
import com.usatiuk.gridblobs.store.stores.MemoryChunkedFileStore;
import jakarta.annotation.Nullable;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Memory store that can be armed to fail reads or writes after a number of chunks.
 */
@Alternative
@Priority(1)
@ApplicationScoped
public class FaultInjectingChunkedFileStore implements ChunkedFileStore {
    @Inject
    MemoryChunkedFileStore delegate;

    private final AtomicInteger _failReadAfter = new AtomicInteger(-1);
    private final AtomicInteger _failWriteAfter = new AtomicInteger(-1);
    private final AtomicBoolean _failAborts = new AtomicBoolean(false);
    private final Semaphore _aborts = new Semaphore(0);

    public void failReadsAfter(int chunks) {
        _failReadAfter.set(chunks);
    }

    public void failWritesAfter(int chunks) {
        _failWriteAfter.set(chunks);
    }

    public void failAborts() {
        _failAborts.set(true);
    }

    public void reset() {
        _failReadAfter.set(-1);
        _failWriteAfter.set(-1);
        _failAborts.set(false);
        _aborts.drainPermits();
    }

    public boolean awaitAbort(long millis) throws InterruptedException {
        return _aborts.tryAcquire(millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public List<StoredFile> findByName(String filename) {
        return delegate.findByName(filename);
    }

    @Override
    public Optional<StoredFile> findById(BlobId id) {
        return delegate.findById(id);
    }

    @Override
    public ChunkIterator openDownloadStream(BlobId id) {
        var inner = delegate.openDownloadStream(id);
        var failAfter = _failReadAfter.get();
        if (failAfter < 0) return inner;
        return new ChunkIterator() {
            private int _read = 0;

            @Override
            public StoredFile file() {
                return inner.file();
            }

            @Override
            public void close() {
                inner.close();
            }

            @Override
            public boolean hasNext() {
                return inner.hasNext();
            }

            @Override
            public byte[] next() {
                if (_read++ >= failAfter)
                    throw new RemoteStoreException("Injected read failure");
                return inner.next();
            }
        };
    }

    @Override
    public UploadSession openUploadStream(String filename, int chunkSize) {
        var inner = delegate.openUploadStream(filename, chunkSize);
        var failAfter = _failWriteAfter.get();
        return new UploadSession() {
            private int _written = 0;

            @Override
            public BlobId id() {
                return inner.id();
            }

            @Override
            public int chunkSize() {
                return inner.chunkSize();
            }

            @Override
            public void writeChunk(byte[] chunk) {
                if (failAfter >= 0 && _written++ >= failAfter)
                    throw new RemoteStoreException("Injected write failure");
                inner.writeChunk(chunk);
            }

            @Override
            public StoredFile finish(@Nullable String checksum) {
                return inner.finish(checksum);
            }

            @Override
            public void abort() {
                var wasOpen = inner.isOpen();
                inner.abort();
                if (wasOpen) _aborts.release();
                if (wasOpen && _failAborts.get())
                    throw new RemoteStoreException("Injected abort failure");
            }

            @Override
            public boolean isOpen() {
                return inner.isOpen();
            }
        };
    }
}
