package io.blog.core.post;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Immutable blog post. Mutations go through {@link #toBuilder()} and produce
 * a new value that replaces the stored one.
 */
public final class Post {

    private final String id;
    private final Identity owner;

    private final String title;
    private final String body;
    private final String imageURL;

    private final long likes;
    private final List<String> comments;

    private final long createdAt;
    private final Long updatedAt; // null until first like/update

    private Post(String id,
                 Identity owner,
                 String title,
                 String body,
                 String imageURL,
                 long likes,
                 List<String> comments,
                 long createdAt,
                 Long updatedAt) {
        this.id = id;
        this.owner = owner;
        this.title = title;
        this.body = body;
        this.imageURL = imageURL;
        this.likes = likes;
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        basicValidate();
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .owner(owner)
                .title(title)
                .body(body)
                .imageURL(imageURL)
                .likes(likes)
                .comments(comments)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static final class Builder {
        private String id;
        private Identity owner;
        private String title;
        private String body;
        private String imageURL;
        private long likes;
        private List<String> comments = new ArrayList<>();
        private long createdAt;
        private Long updatedAt;

        public Builder id(String v) { this.id = v; return this; }
        public Builder owner(Identity v) { this.owner = v; return this; }
        public Builder title(String v) { this.title = v; return this; }
        public Builder body(String v) { this.body = v; return this; }
        public Builder imageURL(String v) { this.imageURL = v; return this; }
        public Builder likes(long v) { this.likes = v; return this; }
        public Builder comments(List<String> v) { this.comments = v != null ? new ArrayList<>(v) : new ArrayList<>(); return this; }
        public Builder addComment(String c) { this.comments.add(c); return this; }
        public Builder createdAt(long ts) { this.createdAt = ts; return this; }
        public Builder updatedAt(Long ts) { this.updatedAt = ts; return this; }

        public Post build() {
            return new Post(id, owner, title, body, imageURL, likes, comments, createdAt, updatedAt);
        }
    }

    // -------------------- getters --------------------
    public String id() { return id; }
    public Identity owner() { return owner; }
    public String title() { return title; }
    public String body() { return body; }
    public String imageURL() { return imageURL; }
    public long likes() { return likes; }
    public List<String> comments() { return comments; }
    public long createdAt() { return createdAt; }
    public OptionalLong updatedAt() { return updatedAt == null ? OptionalLong.empty() : OptionalLong.of(updatedAt); }

    public boolean isOwnedBy(Identity caller) {
        return owner.equals(caller);
    }

    public void basicValidate() {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Missing id");
        if (owner == null) throw new IllegalArgumentException("Missing owner");
        if (title == null || body == null || imageURL == null) throw new IllegalArgumentException("Missing content field");
        if (likes < 0) throw new IllegalArgumentException("likes must be >= 0");
        for (String c : comments) {
            if (c == null) throw new IllegalArgumentException("null comment");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Post)) return false;
        Post other = (Post) o;
        return likes == other.likes
                && createdAt == other.createdAt
                && id.equals(other.id)
                && owner.equals(other.owner)
                && title.equals(other.title)
                && body.equals(other.body)
                && imageURL.equals(other.imageURL)
                && comments.equals(other.comments)
                && Objects.equals(updatedAt, other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, owner, title, body, imageURL, likes, comments, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Post(" + id + ", owner=" + owner.value() + ", likes=" + likes + ", comments=" + comments.size() + ")";
    }
}
