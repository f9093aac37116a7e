package io.blog.core.storage;

import io.blog.core.post.Post;
import io.blog.core.post.PostCodec;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Persistent PostStore using RocksDB.
 *
 * Layout (column families):
 *  - "posts" : key = postId (UTF-8), val = PostCodec JSON
 *
 * Keys are compared bytewise, so values() comes back in id order.
 */
public final class RocksDBPostStore implements PostStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBPostStore.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfPosts;
    private final DBOptions dbOptions;
    private final WriteOptions writeOptions;
    private final String dataDir;

    private RocksDBPostStore(RocksDB db,
                             ColumnFamilyHandle cfDefault,
                             ColumnFamilyHandle cfPosts,
                             DBOptions dbOptions,
                             WriteOptions writeOptions,
                             String dataDir) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfPosts = cfPosts;
        this.dbOptions = dbOptions;
        this.writeOptions = writeOptions;
        this.dataDir = dataDir;
    }

    /** Factory: open/create a store in the given directory, with async writes. */
    public static RocksDBPostStore open(String dataDir) {
        return open(dataDir, false);
    }

    /** Factory: open/create a store; {@code syncWrites} fsyncs the WAL on every write. */
    public static RocksDBPostStore open(String dataDir, boolean syncWrites) {
        try {
            Files.createDirectories(Path.of(dataDir));
        } catch (IOException e) {
            throw new StorageException("Failed to create data directory " + dataDir, e);
        }
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("posts".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            WriteOptions wo = new WriteOptions().setSync(syncWrites);
            LOG.info("Opened post store at " + dataDir + " (syncWrites=" + syncWrites + ")");
            return new RocksDBPostStore(db, cfHandles.get(0), cfHandles.get(1), dbOpts, wo, dataDir);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new StorageException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- PostStore API ----------------

    @Override
    public synchronized void insert(String id, Post post) {
        if (id == null) throw new IllegalArgumentException("null key");
        if (post == null) throw new IllegalArgumentException("null post");
        try {
            db.put(cfPosts, writeOptions, key(id), PostCodec.toBytes(post));
        } catch (RocksDBException e) {
            throw new StorageException("insert failed for post " + id, e);
        }
    }

    @Override
    public synchronized Optional<Post> get(String id) {
        if (id == null) return Optional.empty();
        try {
            byte[] body = db.get(cfPosts, key(id));
            return body == null ? Optional.empty() : Optional.of(PostCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new StorageException("get failed for post " + id, e);
        }
    }

    @Override
    public synchronized Optional<Post> remove(String id) {
        if (id == null) return Optional.empty();
        try {
            byte[] k = key(id);
            byte[] body = db.get(cfPosts, k);
            if (body == null) return Optional.empty();
            db.delete(cfPosts, writeOptions, k);
            return Optional.of(PostCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new StorageException("remove failed for post " + id, e);
        }
    }

    @Override
    public synchronized List<Post> values() {
        List<Post> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfPosts)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(PostCodec.fromBytes(it.value()));
            }
        }
        return out;
    }

    @Override
    public synchronized long size() {
        // RocksJava only exposes an estimate; count keys instead.
        try (RocksIterator it = db.newIterator(cfPosts)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        // CF handles first, then DB/options
        cfPosts.close();
        cfDefault.close();
        db.close();
        writeOptions.close();
        dbOptions.close();
        LOG.info("Closed post store at " + dataDir);
    }

    // -------------- helpers ----------------

    private static byte[] key(String id) {
        return id.getBytes(StandardCharsets.UTF_8);
    }
}
