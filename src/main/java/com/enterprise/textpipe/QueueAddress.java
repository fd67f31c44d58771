package com.enterprise.textpipe;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Where a queue lives: a shared directory or the URL of a queue service.
 * Parsed once; the kind decides which backend serves it.
 */
public final class QueueAddress {

    public enum Kind {
        FILESYSTEM,
        HTTP
    }

    private final Kind kind;
    private final String value;

    private QueueAddress(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Addresses starting with {@code http:} or {@code https:} are services, anything else is a directory
     */
    public static QueueAddress parse(String address) {
        Objects.requireNonNull(address, "address");
        String trimmed = address.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty queue address");
        }
        if (trimmed.startsWith("http:") || trimmed.startsWith("https:")) {
            return new QueueAddress(Kind.HTTP, trimmed);
        }
        return new QueueAddress(Kind.FILESYSTEM, trimmed);
    }

    public Kind getKind() { return kind; }
    public String getValue() { return value; }

    public Path toPath() {
        if (kind != Kind.FILESYSTEM) {
            throw new IllegalStateException("Not a directory address: " + value);
        }
        return Paths.get(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueAddress that = (QueueAddress) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
