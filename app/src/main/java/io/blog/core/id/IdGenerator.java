package io.blog.core.id;

/** Issues post identifiers that are unique for the lifetime of the store. */
public interface IdGenerator {
    String generate();
}
