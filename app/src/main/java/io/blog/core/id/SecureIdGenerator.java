package io.blog.core.id;

import io.blog.core.storage.PostStore;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Random (v4) UUID ids, checked against the store before being handed out.
 * Memory use stays constant: the store itself is the record of issued ids.
 */
public final class SecureIdGenerator implements IdGenerator {
    private static final Logger LOG = Logger.getLogger(SecureIdGenerator.class.getName());

    private final PostStore store;
    private final Supplier<UUID> source;
    private final int maxAttempts;

    public SecureIdGenerator(PostStore store, int maxAttempts) {
        this(store, UUID::randomUUID, maxAttempts);
    }

    public SecureIdGenerator(PostStore store, Supplier<UUID> source, int maxAttempts) {
        this.store = Objects.requireNonNull(store, "store");
        this.source = Objects.requireNonNull(source, "source");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public String generate() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = source.get().toString();
            if (!store.contains(candidate)) {
                return candidate;
            }
            LOG.warning("Generated id " + candidate + " already in use (attempt " + attempt + ")");
        }
        throw new IllegalStateException("No unused id after " + maxAttempts + " attempts");
    }
}
