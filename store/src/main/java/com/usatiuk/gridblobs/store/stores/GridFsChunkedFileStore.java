package com.usatiuk.gridblobs.store.stores;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.GridFSBuckets;
import com.mongodb.client.gridfs.GridFSUploadStream;
import com.mongodb.client.gridfs.model.GridFSFile;
import com.mongodb.client.gridfs.model.GridFSUploadOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.usatiuk.gridblobs.store.*;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.logging.Log;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Nullable;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Chunked file store backed by a MongoDB GridFS bucket.
 */
@ApplicationScoped
@IfBuildProperty(name = "gridblobs.store.backend", stringValue = "gridfs", enableIfMissing = true)
public class GridFsChunkedFileStore implements ChunkedFileStore {
    // Kept in the metadata subdocument of the files collection
    static final String CHECKSUM_FIELD = "sha256";

    private final String _connectionString;
    private final String _databaseName;
    private final String _bucketName;

    private MongoClient _client;
    private GridFSBucket _bucket;
    private MongoCollection<Document> _filesCollection;
    private MongoCollection<Document> _chunksCollection;
    private boolean _ready = false;

    @Inject
    public GridFsChunkedFileStore(@ConfigProperty(name = "gridblobs.mongodb.connection-string", defaultValue = "mongodb://localhost:27017") String connectionString,
                                  @ConfigProperty(name = "gridblobs.mongodb.database", defaultValue = "gridblobs") String databaseName,
                                  @ConfigProperty(name = "gridblobs.mongodb.bucket", defaultValue = "fs") String bucketName) {
        _connectionString = connectionString;
        _databaseName = databaseName;
        _bucketName = bucketName;
    }

    // Works on already opened collections, without a client of its own
    GridFsChunkedFileStore(GridFSBucket bucket, MongoCollection<Document> filesCollection, MongoCollection<Document> chunksCollection) {
        _connectionString = null;
        _databaseName = null;
        _bucketName = bucket.getBucketName();
        _bucket = bucket;
        _filesCollection = filesCollection;
        _chunksCollection = chunksCollection;
        _ready = true;
    }

    void init(@Observes @Priority(100) StartupEvent event) {
        Log.infov("Opening GridFS bucket {0} in database {1}", _bucketName, _databaseName);
        _client = MongoClients.create(_connectionString);
        var database = _client.getDatabase(_databaseName);
        _bucket = GridFSBuckets.create(database, _bucketName);
        _filesCollection = database.getCollection(_bucketName + ".files");
        _chunksCollection = database.getCollection(_bucketName + ".chunks");
        _ready = true;
        Log.info("GridFS storage ready");
    }

    void shutdown(@Observes @Priority(900) ShutdownEvent event) {
        if (!_ready) {
            return;
        }
        _ready = false;
        if (_client != null)
            _client.close();
        Log.info("GridFS storage closed");
    }

    private void verifyReady() {
        if (!_ready) throw new IllegalStateException("Wrong service order!");
    }

    private static <T> T remote(String what, Supplier<T> fn) {
        try {
            return fn.get();
        } catch (MongoException e) {
            Log.error("GridFS operation failed: " + what, e);
            throw new RemoteStoreException("GridFS operation failed: " + what, e);
        }
    }

    static BsonValue toBson(BlobId id) {
        if (ObjectId.isValid(id.value()))
            return new BsonObjectId(new ObjectId(id.value()));
        return new BsonString(id.value());
    }

    static BlobId fromBson(BsonValue value) {
        if (value.isObjectId())
            return BlobId.of(value.asObjectId().getValue().toHexString());
        if (value.isString())
            return BlobId.of(value.asString().getValue());
        throw new RemoteStoreException("Unsupported GridFS file id type: " + value.getBsonType());
    }

    static StoredFile toStoredFile(GridFSFile file) {
        Document metadata = file.getMetadata();
        String checksum = metadata != null ? metadata.getString(CHECKSUM_FIELD) : null;
        return new StoredFile(fromBson(file.getId()), file.getFilename(), file.getLength(), file.getChunkSize(),
                file.getUploadDate().toInstant(), checksum);
    }

    @Override
    public List<StoredFile> findByName(String filename) {
        verifyReady();
        return remote("find " + filename, () -> {
            var found = new ArrayList<StoredFile>();
            _bucket.find(Filters.eq("filename", filename))
                    .sort(Sorts.descending("uploadDate", "_id"))
                    .forEach(f -> found.add(toStoredFile(f)));
            return List.copyOf(found);
        });
    }

    @Override
    public Optional<StoredFile> findById(BlobId id) {
        verifyReady();
        return remote("find " + id, () ->
                Optional.ofNullable(_bucket.find(Filters.eq("_id", toBson(id))).first()).map(GridFsChunkedFileStore::toStoredFile));
    }

    @Override
    public ChunkIterator openDownloadStream(BlobId id) {
        var file = findById(id).orElseThrow(() -> BlobNotFoundException.forId(id));
        return remote("download " + id, () -> new GridFsChunkIterator(file, _bucket.openDownloadStream(toBson(id))));
    }

    @Override
    public UploadSession openUploadStream(String filename, int chunkSize) {
        verifyReady();
        var oid = new BsonObjectId(new ObjectId());
        var stream = remote("upload " + filename, () ->
                _bucket.openUploadStream(oid, filename, new GridFSUploadOptions().chunkSizeBytes(chunkSize)));
        return new GridFsUploadSession(fromBson(oid), filename, chunkSize, stream);
    }

    /**
     * Upload through a GridFS upload stream.
     * <p>
     * Publishing takes two steps: closing the stream inserts the files document, then the checksum
     * is set on it. Between the two a reader may see the file without a checksum, and if setting
     * the checksum fails the file is deleted again after having been visible.
     */
    private class GridFsUploadSession extends BaseUploadSession {
        private final GridFSUploadStream _stream;
        private final OutputStream _out;
        private boolean _closing = false;
        private boolean _published = false;

        private GridFsUploadSession(BlobId id, String filename, int chunkSize, GridFSUploadStream stream) {
            super(id, filename, chunkSize);
            _stream = stream;
            _out = stream;
        }

        @Override
        protected void doWriteChunk(long n, byte[] chunk) {
            try {
                _out.write(chunk);
            } catch (IOException | MongoException e) {
                throw new RemoteStoreException("GridFS operation failed: upload chunk " + n + " of " + _id, e);
            }
        }

        @Override
        protected StoredFile doFinish(long length, @Nullable String checksum) {
            // Closing the stream writes the files document, which publishes the upload
            _closing = true;
            try {
                _out.close();
            } catch (IOException | MongoException e) {
                throw new RemoteStoreException("GridFS operation failed: publish " + _id, e);
            }
            _published = true;
            if (checksum != null) {
                remote("set checksum of " + _id, () ->
                        _filesCollection.updateOne(Filters.eq("_id", toBson(_id)), Updates.set("metadata." + CHECKSUM_FIELD, checksum)));
            }
            Log.debugv("Published {0} as {1} ({2} bytes)", _filename, _id, length);
            return findById(_id).orElseThrow(() -> new RemoteStoreException("Published file " + _id + " is not visible"));
        }

        @Override
        protected void doAbort() {
            Log.debugv("Aborting upload of {0} ({1})", _filename, _id);
            if (_published) {
                // The files document is already visible, take it back down
                remote("delete " + _id, () -> {
                    _bucket.delete(toBson(_id));
                    return null;
                });
            } else if (_closing) {
                // The driver marks the stream closed even when close fails, so abort() would refuse
                remote("delete chunks of " + _id, () -> {
                    _filesCollection.deleteOne(Filters.eq("_id", toBson(_id)));
                    return _chunksCollection.deleteMany(Filters.eq("files_id", toBson(_id)));
                });
            } else {
                remote("abort " + _id, () -> {
                    _stream.abort();
                    return null;
                });
            }
        }
    }
}
