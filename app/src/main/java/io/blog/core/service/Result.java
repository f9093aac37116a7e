package io.blog.core.service;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Outcome of a service call: either a value or an error code with a message.
 */
public final class Result<T> {
    private final T value;
    private final PostError error;
    private final String message;

    private Result(T value, PostError error, String message) {
        this.value = value; this.error = error; this.message = message;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Result<T> error(PostError e, String msg) {
        return new Result<>(null, Objects.requireNonNull(e, "error"), msg);
    }

    public boolean isOk() { return error == null; }

    /** The success value; throws if this is an error result. */
    public T value() {
        if (error != null) {
            throw new NoSuchElementException("Result is an error: " + this);
        }
        return value;
    }

    public PostError error() { return error; }
    public String message() { return message; }

    @Override public String toString() {
        return isOk() ? "OK" : ("ERR[" + error + "]: " + message);
    }
}
