package io.blog.core.post;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostCodecTest {

    @Test
    void unsetUpdatedAtIsWrittenAsNull() {
        Post post = Post.builder()
                .id("p1")
                .owner(Identity.of("2vxsx-fae"))
                .title("Hello")
                .body("Ünïcödé body")
                .imageURL("http://img")
                .createdAt(1_700_000_000_000L)
                .build();

        byte[] bytes = PostCodec.toBytes(post);
        assertTrue(new String(bytes, StandardCharsets.UTF_8).contains("\"updatedAt\":null"));

        Post decoded = PostCodec.fromBytes(bytes);
        assertEquals(post, decoded);
        assertTrue(decoded.updatedAt().isEmpty());
    }

    @Test
    void keepsCommentsAndCounters() {
        Post post = Post.builder()
                .id("p2")
                .owner(Identity.of("bob"))
                .title("t")
                .body("b")
                .imageURL("i")
                .likes(7)
                .comments(List.of("one", "two"))
                .createdAt(10L)
                .updatedAt(20L)
                .build();

        Post decoded = PostCodec.fromBytes(PostCodec.toBytes(post));
        assertEquals(List.of("one", "two"), decoded.comments());
        assertEquals(7, decoded.likes());
        assertEquals(20L, decoded.updatedAt().getAsLong());
    }

    @Test
    void rejectsMalformedBytes() {
        assertThrows(IllegalArgumentException.class,
                () -> PostCodec.fromBytes("not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(IllegalArgumentException.class,
                () -> PostCodec.fromBytes("{\"id\":\"x\"}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void postRejectsNegativeLikes() {
        assertThrows(IllegalArgumentException.class, () -> Post.builder()
                .id("p")
                .owner(Identity.of("a"))
                .title("t").body("b").imageURL("i")
                .likes(-1)
                .build());
    }
}
