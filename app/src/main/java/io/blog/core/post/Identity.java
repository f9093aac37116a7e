package io.blog.core.post;

import java.util.Objects;

/**
 * Opaque caller identity as handed over by the hosting environment.
 * Two identities are the same caller iff their values are equal.
 */
public final class Identity {
    private final String value;

    private Identity(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Identity must not be blank");
        }
        this.value = value;
    }

    public static Identity of(String value) {
        return new Identity(value);
    }

    public String value() { return value; }

    @Override public boolean equals(Object o) { return o instanceof Identity && value.equals(((Identity) o).value); }
    @Override public int hashCode() { return Objects.hashCode(value); }
    @Override public String toString() { return "Identity(" + value + ")"; }
}
