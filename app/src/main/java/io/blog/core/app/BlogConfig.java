package io.blog.core.app;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/** Simple config holder for a blog instance. */
public final class BlogConfig {

    public enum StoreKind { ROCKSDB, MEMORY }

    public final Path dataDir;
    public final StoreKind storeKind;
    public final int idMaxAttempts;
    public final boolean syncWrites;

    public BlogConfig(Path dataDir, StoreKind storeKind, int idMaxAttempts, boolean syncWrites) {
        if (dataDir == null) throw new IllegalArgumentException("dataDir required");
        if (storeKind == null) throw new IllegalArgumentException("storeKind required");
        if (idMaxAttempts <= 0) throw new IllegalArgumentException("idMaxAttempts must be > 0");
        this.dataDir = dataDir;
        this.storeKind = storeKind;
        this.idMaxAttempts = idMaxAttempts;
        this.syncWrites = syncWrites;
    }

    public static BlogConfig defaultLocal() {
        return new BlogConfig(
                Path.of("./data/blog"),
                StoreKind.ROCKSDB,
                8,          // id draws before giving up
                false       // async WAL writes
        );
    }

    /**
     * Defaults overridden by BLOG_DATA_DIR, BLOG_STORE (rocksdb|memory),
     * BLOG_ID_MAX_ATTEMPTS and BLOG_SYNC_WRITES.
     */
    public static BlogConfig fromEnv(Map<String, String> env) {
        BlogConfig defaults = defaultLocal();
        Path dataDir = defaults.dataDir;
        String dir = env.get("BLOG_DATA_DIR");
        if (dir != null && !dir.isBlank()) {
            dataDir = Path.of(dir);
        }
        StoreKind kind = defaults.storeKind;
        String store = env.get("BLOG_STORE");
        if (store != null && !store.isBlank()) {
            try {
                kind = StoreKind.valueOf(store.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for BLOG_STORE: " + store);
            }
        }
        int attempts = defaults.idMaxAttempts;
        String attemptsEnv = env.get("BLOG_ID_MAX_ATTEMPTS");
        if (attemptsEnv != null && !attemptsEnv.isBlank()) {
            attempts = parsePositiveInt(attemptsEnv, "BLOG_ID_MAX_ATTEMPTS");
        }
        boolean sync = defaults.syncWrites;
        String syncEnv = env.get("BLOG_SYNC_WRITES");
        if (syncEnv != null && !syncEnv.isBlank()) {
            sync = "true".equalsIgnoreCase(syncEnv.trim());
        }
        return new BlogConfig(dataDir, kind, attempts, sync);
    }

    public static BlogConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public BlogConfig withDataDir(Path dataDir) {
        return new BlogConfig(dataDir, this.storeKind, this.idMaxAttempts, this.syncWrites);
    }

    public BlogConfig withStoreKind(StoreKind storeKind) {
        return new BlogConfig(this.dataDir, storeKind, this.idMaxAttempts, this.syncWrites);
    }

    private static int parsePositiveInt(String value, String key) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new NumberFormatException();
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
        }
    }
}
