package io.blog.core.storage;

import io.blog.core.post.Identity;
import io.blog.core.post.Post;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryPostStoreTest {

    @Test
    void insertGetRemove() {
        PostStore store = new InMemoryPostStore();
        Post p = post("p1", "first");

        store.insert(p.id(), p);
        assertEquals(1, store.size());
        assertEquals(p, store.get("p1").orElseThrow());

        assertEquals(p, store.remove("p1").orElseThrow());
        assertTrue(store.get("p1").isEmpty());
        assertTrue(store.remove("p1").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void insertOverwritesExistingValue() {
        PostStore store = new InMemoryPostStore();
        store.insert("p1", post("p1", "old"));
        store.insert("p1", post("p1", "new"));

        assertEquals(1, store.size());
        assertEquals("new", store.get("p1").orElseThrow().title());
    }

    @Test
    void valuesComeBackInKeyOrder() {
        PostStore store = new InMemoryPostStore();
        store.insert("c", post("c", "3"));
        store.insert("a", post("a", "1"));
        store.insert("b", post("b", "2"));

        List<String> ids = store.values().stream().map(Post::id).collect(Collectors.toList());
        assertEquals(List.of("a", "b", "c"), ids);
    }

    static Post post(String id, String title) {
        return Post.builder()
                .id(id)
                .owner(Identity.of("alice"))
                .title(title)
                .body("body")
                .imageURL("http://img/" + id)
                .createdAt(1L)
                .build();
    }
}
