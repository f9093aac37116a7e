package io.blog.core.storage;

import io.blog.core.post.Post;

import java.util.List;
import java.util.Optional;

/**
 * Ordered key-value persistence for posts, keyed by post id.
 *
 * Notes:
 * - insert is an upsert; id uniqueness is the id generator's job, not the store's.
 * - values() enumerates in key order, not creation order.
 */
public interface PostStore {

    /** Store a post under the given id, replacing any previous value. */
    void insert(String id, Post post);

    /** Point lookup. */
    Optional<Post> get(String id);

    /** Delete and return the prior value, if any. */
    Optional<Post> remove(String id);

    /** All stored posts in key order. */
    List<Post> values();

    /** Number of posts stored (debug/metrics). */
    long size();

    default boolean contains(String id) {
        return get(id).isPresent();
    }
}
