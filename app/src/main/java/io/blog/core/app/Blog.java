package io.blog.core.app;

import io.blog.core.id.IdGenerator;
import io.blog.core.id.SecureIdGenerator;
import io.blog.core.service.PostService;
import io.blog.core.storage.InMemoryPostStore;
import io.blog.core.storage.PostStore;
import io.blog.core.storage.RocksDBPostStore;

import java.time.Clock;
import java.util.logging.Logger;

/**
 * Wires the post store, id generator and service.
 * Open once per process and close on shutdown to release the store.
 */
public final class Blog implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Blog.class.getName());

    private final PostStore store;
    private final PostService posts;

    public Blog(PostStore store, BlogConfig config, Clock clock) {
        this.store = store;
        IdGenerator ids = new SecureIdGenerator(store, config.idMaxAttempts);
        this.posts = new PostService(store, ids, clock);
    }

    /** Convenience factory for a throwaway in-memory blog. */
    public static Blog inMemory(BlogConfig config) {
        return new Blog(new InMemoryPostStore(), config, Clock.systemUTC());
    }

    /** Convenience factory for a RocksDB-backed blog under config.dataDir. */
    public static Blog rocks(BlogConfig config) {
        String dir = config.dataDir.toAbsolutePath().normalize().toString();
        return new Blog(RocksDBPostStore.open(dir, config.syncWrites), config, Clock.systemUTC());
    }

    /** Pick the store from config.storeKind. */
    public static Blog open(BlogConfig config) {
        switch (config.storeKind) {
            case MEMORY:
                return inMemory(config);
            case ROCKSDB:
            default:
                return rocks(config);
        }
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close post store", e);
            }
        }
        LOG.fine("Blog closed");
    }

    public PostStore store() { return store; }
    public PostService posts() { return posts; }
}
