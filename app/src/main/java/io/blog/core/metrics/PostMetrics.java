package io.blog.core.metrics;

import io.blog.core.service.Result;
import io.blog.core.storage.StorageException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.function.Supplier;

public final class PostMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();

    private PostMetrics() {}

    /**
     * Time one service call and count it by outcome: "ok", the error code, or
     * "storage_error" / "exception" when the call throws.
     */
    public static <T> Result<T> record(String operation, Supplier<Result<T>> call) {
        Timer timer = Timer.builder("posts.request.time")
                .description("Post service call duration")
                .tag("operation", operation)
                .register(registry);
        Result<T> result;
        try {
            result = timer.record(call);
        } catch (RuntimeException e) {
            requests(operation, e instanceof StorageException ? "storage_error" : "exception").increment();
            throw e;
        }
        requests(operation, outcome(result)).increment();
        return result;
    }

    public static double count(String operation, String outcome) {
        return requests(operation, outcome).count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName()).append("{");
                for (Tag tag : m.getId().getTags()) {
                    sb.append(tag.getKey()).append("=").append(tag.getValue()).append(",");
                }
                sb.append("stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }

    private static Counter requests(String operation, String outcome) {
        return Counter.builder("posts.requests")
                .description("Post service calls by outcome")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry);
    }

    private static String outcome(Result<?> result) {
        if (result == null || result.isOk()) {
            return "ok";
        }
        return result.error().name().toLowerCase(Locale.ROOT);
    }
}
