package io.blog.core.storage;

import io.blog.core.post.Post;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Simple in-memory post store.
 * Good for tests and throwaway runs; nothing survives the process.
 */
public final class InMemoryPostStore implements PostStore {

    /** Map: postId -> Post, sorted by id like the RocksDB key space. */
    private final NavigableMap<String, Post> posts = new TreeMap<>();

    @Override
    public synchronized void insert(String id, Post post) {
        if (id == null) throw new IllegalArgumentException("null key");
        if (post == null) throw new IllegalArgumentException("null post");
        posts.put(id, post);
    }

    @Override
    public synchronized Optional<Post> get(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(posts.get(id));
    }

    @Override
    public synchronized Optional<Post> remove(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(posts.remove(id));
    }

    @Override
    public synchronized List<Post> values() {
        return new ArrayList<>(posts.values());
    }

    @Override
    public synchronized long size() {
        return posts.size();
    }
}
