package com.usatiuk.gridblobs.client;

import com.usatiuk.gridblobs.client.index.ObjectRecord;
import com.usatiuk.gridblobs.client.sync.LocalSync;
import com.usatiuk.gridblobs.store.BlobId;
import io.quarkus.logging.Log;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs {@link BlobClient} and {@link LocalSync} operations on a worker pool.
 * <p>
 * Cancelling a returned future interrupts the worker. A write interrupted before it
 * publishes is aborted and leaves nothing behind.
 */
@ApplicationScoped
public class AsyncBlobClient {
    @Inject
    BlobClient blobClient;
    @Inject
    LocalSync localSync;

    @ConfigProperty(name = "gridblobs.async.threads", defaultValue = "4")
    int threads;

    private ExecutorService _executor;

    void init(@Observes @Priority(200) StartupEvent event) {
        BasicThreadFactory factory = new BasicThreadFactory.Builder()
                .namingPattern("gridblobs-async-%d")
                .build();
        _executor = Executors.newFixedThreadPool(threads, factory);
        Log.infov("Started async client with {0} threads", threads);
    }

    void shutdown(@Observes @Priority(800) ShutdownEvent event) {
        Log.info("Stopping async client");
        _executor.shutdownNow();
    }

    private static class CancellableFuture<T> extends CompletableFuture<T> {
        private Future<?> _task;
        private boolean _cancelled = false;

        synchronized void setTask(Future<?> task) {
            _task = task;
            if (_cancelled) task.cancel(true);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            var ret = super.cancel(mayInterruptIfRunning);
            if (!ret) return false;
            synchronized (this) {
                _cancelled = true;
                if (_task != null) _task.cancel(true);
            }
            return true;
        }
    }

    private <T> CompletableFuture<T> submit(String what, Callable<T> fn) {
        if (_executor == null)
            throw new IllegalStateException("Async client is not started");
        var result = new CancellableFuture<T>();
        result.setTask(_executor.submit(() -> {
            if (result.isDone()) return;
            try {
                result.complete(fn.call());
            } catch (Throwable e) {
                if (result.isCancelled())
                    Log.debugv("{0} stopped after cancellation: {1}", what, e.toString());
                else
                    Log.debugv("{0} failed: {1}", what, e.toString());
                result.completeExceptionally(e);
            }
        }));
        return result;
    }

    public CompletableFuture<Boolean> exists(String name) {
        return submit("exists " + name, () -> blobClient.exists(name));
    }

    public CompletableFuture<BlobId> id(String name) {
        return submit("id " + name, () -> blobClient.id(name));
    }

    public CompletableFuture<ObjectRecord> describe(String name) {
        return submit("describe " + name, () -> blobClient.describe(name));
    }

    public CompletableFuture<ObjectRecord> describe(BlobId id) {
        return submit("describe " + id, () -> blobClient.describe(id));
    }

    public CompletableFuture<byte[]> readBytes(String name) {
        return submit("read " + name, () -> blobClient.readBytes(name));
    }

    public CompletableFuture<byte[]> readBytes(BlobId id) {
        return submit("read " + id, () -> blobClient.readBytes(id));
    }

    public CompletableFuture<String> readText(String name) {
        return submit("read " + name, () -> blobClient.readText(name));
    }

    public CompletableFuture<String> readText(BlobId id) {
        return submit("read " + id, () -> blobClient.readText(id));
    }

    public CompletableFuture<ObjectRecord> writeBytes(String name, byte[] bytes) {
        return submit("write " + name, () -> blobClient.writeBytes(name, bytes));
    }

    public CompletableFuture<ObjectRecord> writeText(String name, String text) {
        return submit("write " + name, () -> blobClient.writeText(name, text));
    }

    public CompletableFuture<ObjectRecord> writeFrom(String name, InputStream in) {
        return submit("write " + name, () -> blobClient.writeFrom(name, in));
    }

    public CompletableFuture<BlobId> downloadTo(String name, Path path) {
        return submit("download " + name, () -> localSync.downloadTo(name, path));
    }

    public CompletableFuture<BlobId> downloadTo(BlobId id, Path path) {
        return submit("download " + id, () -> localSync.downloadTo(id, path));
    }

    public CompletableFuture<BlobId> uploadFrom(String name, Path path) {
        return submit("upload " + name, () -> localSync.uploadFrom(name, path));
    }
}
