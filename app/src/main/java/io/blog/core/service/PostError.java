package io.blog.core.service;

public enum PostError {
    /** A required field is missing or empty. */
    INVALID_INPUT,
    /** The id does not resolve to a stored post. */
    NOT_FOUND,
    /** Caller is not the owner (update/delete). */
    UNAUTHORIZED,
    /** Owner trying to like their own post. */
    FORBIDDEN
}
