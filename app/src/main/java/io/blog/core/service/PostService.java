package io.blog.core.service;

import io.blog.core.id.IdGenerator;
import io.blog.core.metrics.PostMetrics;
import io.blog.core.post.Identity;
import io.blog.core.post.Post;
import io.blog.core.post.PostPayload;
import io.blog.core.storage.PostStore;
import io.blog.core.storage.StorageException;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request handlers for posts. Every call reads the store, builds the new post value
 * and writes it back; a failed precondition leaves the stored post untouched.
 *
 * Ownership rules:
 * - only the owner may update or delete a post,
 * - the owner may not like their own post,
 * - anyone may comment.
 */
public final class PostService {
    private static final Logger LOG = Logger.getLogger(PostService.class.getName());

    private final PostStore store;
    private final IdGenerator ids;
    private final Clock clock;

    public PostService(PostStore store, IdGenerator ids, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Caller identities are required; a null caller is a programming error (NullPointerException). */
    public Result<Post> addPost(Identity caller, PostPayload payload) {
        Objects.requireNonNull(caller, "caller");
        return handle("addPost", () -> {
            if (payload == null || payload.hasMissingFields()) {
                return Result.error(PostError.INVALID_INPUT, "Missing required fields");
            }
            Post post = Post.builder()
                    .id(ids.generate())
                    .owner(caller)
                    .title(payload.title)
                    .body(payload.body)
                    .imageURL(payload.imageURL)
                    .likes(0)
                    .createdAt(clock.millis())
                    .updatedAt(null)
                    .build();
            store.insert(post.id(), post);
            return Result.ok(post);
        });
    }

    public Result<Post> getPost(String id) {
        return handle("getPost", () -> store.get(id)
                .map(Result::ok)
                .orElseGet(() -> Result.error(PostError.NOT_FOUND, "A post with id=" + id + " not found")));
    }

    public Result<List<Post>> getAllPosts() {
        return handle("getAllPosts", () -> Result.ok(store.values()));
    }

    public Result<Post> updatePost(Identity caller, String id, PostPayload payload) {
        Objects.requireNonNull(caller, "caller");
        return handle("updatePost", () -> {
            Optional<Post> existing = store.get(id);
            if (existing.isEmpty()) {
                return Result.error(PostError.NOT_FOUND, "Couldn't update post with id=" + id + ". Post not found");
            }
            Post post = existing.get();
            if (!post.isOwnedBy(caller)) {
                return Result.error(PostError.UNAUTHORIZED, "Only the owner can update the post");
            }
            if (payload == null || payload.hasMissingFields()) {
                return Result.error(PostError.INVALID_INPUT, "Missing required fields");
            }
            Post updated = post.toBuilder()
                    .title(payload.title)
                    .body(payload.body)
                    .imageURL(payload.imageURL)
                    .updatedAt(clock.millis())
                    .build();
            store.insert(id, updated);
            return Result.ok(updated);
        });
    }

    public Result<Post> deletePost(Identity caller, String id) {
        Objects.requireNonNull(caller, "caller");
        return handle("deletePost", () -> {
            Optional<Post> existing = store.get(id);
            if (existing.isEmpty()) {
                return Result.error(PostError.NOT_FOUND, "Couldn't delete post with id=" + id + ". Post not found");
            }
            if (!existing.get().isOwnedBy(caller)) {
                return Result.error(PostError.UNAUTHORIZED, "Only the owner can delete the post");
            }
            Post removed = store.remove(id).orElse(existing.get());
            return Result.ok(removed);
        });
    }

    public Result<Post> likePost(Identity caller, String id) {
        Objects.requireNonNull(caller, "caller");
        return handle("likePost", () -> {
            Optional<Post> existing = store.get(id);
            if (existing.isEmpty()) {
                return Result.error(PostError.NOT_FOUND, "Couldn't like post with id=" + id + ". Post not found");
            }
            Post post = existing.get();
            if (post.isOwnedBy(caller)) {
                return Result.error(PostError.FORBIDDEN, "Owners cannot like their own post");
            }
            Post updated = post.toBuilder()
                    .likes(Math.addExact(post.likes(), 1L))
                    .updatedAt(clock.millis())
                    .build();
            store.insert(id, updated);
            return Result.ok(updated);
        });
    }

    public Result<Post> commentOnPost(String id, String comment) {
        return handle("commentOnPost", () -> {
            Optional<Post> existing = store.get(id);
            if (existing.isEmpty()) {
                return Result.error(PostError.NOT_FOUND, "Couldn't comment on post with id=" + id + ". Post not found");
            }
            Post updated = existing.get().toBuilder()
                    .addComment(comment == null ? "" : comment)
                    .build();
            store.insert(id, updated);
            return Result.ok(updated);
        });
    }

    private static <T> Result<T> handle(String operation, Supplier<Result<T>> call) {
        try {
            Result<T> result = PostMetrics.record(operation, call);
            LOG.fine(() -> operation + " -> " + result);
            return result;
        } catch (StorageException e) {
            LOG.log(Level.WARNING, operation + " failed on storage", e);
            throw e;
        }
    }
}
