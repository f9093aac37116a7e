package io.blog.core.storage;

import io.blog.core.post.Post;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBPostStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void postsSurviveReopen() {
        String dir = tempDir.resolve("posts").toString();
        Post liked = InMemoryPostStoreTest.post("p1", "title").toBuilder()
                .likes(3)
                .addComment("nice")
                .updatedAt(42L)
                .build();

        try (RocksDBPostStore store = RocksDBPostStore.open(dir)) {
            store.insert(liked.id(), liked);
            store.insert("p2", InMemoryPostStoreTest.post("p2", "other"));
            assertEquals(2, store.size());
        }

        try (RocksDBPostStore store = RocksDBPostStore.open(dir, true)) {
            assertEquals(2, store.size());
            assertEquals(liked, store.get("p1").orElseThrow());
            assertTrue(store.get("p2").orElseThrow().updatedAt().isEmpty());
        }
    }

    @Test
    void removeReturnsPriorValueAndPersists() {
        String dir = tempDir.resolve("remove").toString();
        Post p = InMemoryPostStoreTest.post("p1", "title");

        try (RocksDBPostStore store = RocksDBPostStore.open(dir)) {
            store.insert(p.id(), p);
            assertEquals(p, store.remove("p1").orElseThrow());
            assertTrue(store.remove("p1").isEmpty());
        }
        try (RocksDBPostStore store = RocksDBPostStore.open(dir)) {
            assertTrue(store.get("p1").isEmpty());
            assertEquals(0, store.size());
        }
    }

    @Test
    void valuesIterateInKeyOrder() {
        try (RocksDBPostStore store = RocksDBPostStore.open(tempDir.resolve("order").toString())) {
            store.insert("b", InMemoryPostStoreTest.post("b", "2"));
            store.insert("a", InMemoryPostStoreTest.post("a", "1"));
            store.insert("c", InMemoryPostStoreTest.post("c", "3"));
            store.insert("a", InMemoryPostStoreTest.post("a", "1b"));

            List<Post> values = store.values();
            assertEquals(List.of("a", "b", "c"), values.stream().map(Post::id).collect(Collectors.toList()));
            assertEquals("1b", values.get(0).title());
        }
    }
}
