package io.blog.core.post;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of a {@link Post} as persisted by the store.
 *
 * Layout: {@code {id, owner, title, body, imageURL, likes, comments[], createdAt, updatedAt}},
 * with {@code updatedAt} written as JSON null while unset.
 */
public final class PostCodec {
    private static final ObjectMapper JSON = new ObjectMapper();

    private PostCodec(){}

    public static byte[] toBytes(Post post) {
        ObjectNode node = JSON.createObjectNode()
                .put("id", post.id())
                .put("owner", post.owner().value())
                .put("title", post.title())
                .put("body", post.body())
                .put("imageURL", post.imageURL())
                .put("likes", post.likes());
        ArrayNode comments = node.putArray("comments");
        post.comments().forEach(comments::add);
        node.put("createdAt", post.createdAt());
        if (post.updatedAt().isPresent()) {
            node.put("updatedAt", post.updatedAt().getAsLong());
        } else {
            node.putNull("updatedAt");
        }
        try {
            return JSON.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode post " + post.id(), e);
        }
    }

    public static Post fromBytes(byte[] bytes) {
        try {
            JsonNode node = JSON.readTree(bytes);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Post bytes are not a JSON object");
            }
            List<String> comments = new ArrayList<>();
            for (JsonNode c : required(node, "comments")) {
                comments.add(c.asText());
            }
            JsonNode updated = node.get("updatedAt");
            return Post.builder()
                    .id(required(node, "id").asText())
                    .owner(Identity.of(required(node, "owner").asText()))
                    .title(required(node, "title").asText())
                    .body(required(node, "body").asText())
                    .imageURL(required(node, "imageURL").asText())
                    .likes(required(node, "likes").asLong())
                    .comments(comments)
                    .createdAt(required(node, "createdAt").asLong())
                    .updatedAt(updated == null || updated.isNull() ? null : updated.asLong())
                    .build();
        } catch (IOException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Post bytes", ex);
        }
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field: " + field);
        }
        return value;
    }
}
