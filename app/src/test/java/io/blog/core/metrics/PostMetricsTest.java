package io.blog.core.metrics;

import io.blog.core.service.PostError;
import io.blog.core.service.Result;
import io.blog.core.storage.StorageException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class PostMetricsTest {

    @Test
    void countsByOutcome() {
        double okBefore = PostMetrics.count("metricsSample", "ok");
        double forbiddenBefore = PostMetrics.count("metricsSample", "forbidden");

        Result<String> ok = PostMetrics.record("metricsSample", () -> Result.ok("x"));
        PostMetrics.record("metricsSample", () -> Result.<String>error(PostError.FORBIDDEN, "no"));

        assertEquals("x", ok.value());
        assertEquals(okBefore + 1, PostMetrics.count("metricsSample", "ok"));
        assertEquals(forbiddenBefore + 1, PostMetrics.count("metricsSample", "forbidden"));
        String scrape = PostMetrics.scrapeMetrics();
        assertTrue(scrape.contains("posts.requests{operation=metricsSample,outcome=ok,stat=COUNT}"));
        assertTrue(scrape.contains("posts.requests{operation=metricsSample,outcome=forbidden,stat=COUNT}"));
    }

    @Test
    void thrownStorageFaultsAreCounted() {
        double before = PostMetrics.count("metricsFault", "storage_error");

        assertThrows(StorageException.class, () -> PostMetrics.<String>record("metricsFault", () -> {
            throw new StorageException("disk", new IOException("disk"));
        }));

        assertEquals(before + 1, PostMetrics.count("metricsFault", "storage_error"));
        assertTrue(PostMetrics.scrapeMetrics().contains("posts.requests{operation=metricsFault,outcome=storage_error,stat=COUNT}"));
    }
}
