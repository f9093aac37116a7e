package io.blog.core.storage;

/** Unchecked wrapper for failures of the underlying storage engine. */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
