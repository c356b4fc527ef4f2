package io.ietfdata.core;

import java.net.URI;
import java.util.Objects;

/**
 * Server-relative reference to a Datatracker resource of one specific kind.
 *
 * <p>Each resource kind has its own final subclass, so a {@code PersonUri} cannot be passed where a
 * {@code DocumentUri} is expected. Two references are equal only when they are of the same kind and
 * carry the same path. A reference never holds the entity it names.
 *
 * <p>Validation is local: a non-empty path must start with the API prefix of its kind.
 */
public abstract class ResourceUri implements Comparable<ResourceUri> {

    private final String path;

    protected ResourceUri(String path, String prefix) {
        this.path = validate(path, prefix, getClass());
    }

    /**
     * Server-relative path, including the trailing slash, e.g. {@code /api/v1/person/person/20209/}.
     */
    public final String path() {
        return path;
    }

    /**
     * Short, human readable resource kind, e.g. {@code "person"}.
     */
    public abstract String kind();

    public final boolean isEmpty() {
        return path.isEmpty();
    }

    /**
     * Resolves this reference against the API origin.
     *
     * @param origin the API origin, e.g. {@code https://datatracker.ietf.org}
     * @return the absolute resource URL
     * @throws DatatrackerException.InvalidUri if this reference is empty
     */
    public final URI resolve(URI origin) {
        Objects.requireNonNull(origin, "origin");
        if (path.isEmpty()) {
            throw new DatatrackerException.InvalidUri("cannot resolve an empty " + kind() + " reference");
        }
        return origin.resolve(path);
    }

    /**
     * Last non-empty path segment, i.e. the identifier the server uses for this resource.
     */
    protected final String lastSegment() {
        if (path.isEmpty()) {
            throw new DatatrackerException.InvalidUri("empty " + kind() + " reference has no identifier");
        }
        int end = path.endsWith("/") ? path.length() - 1 : path.length();
        int start = path.lastIndexOf('/', end - 1) + 1;
        return path.substring(start, end);
    }

    protected final long numericId() {
        String segment = lastSegment();
        try {
            return Long.parseLong(segment);
        } catch (NumberFormatException e) {
            throw new DatatrackerException.InvalidUri(kind() + " reference has a non-numeric identifier: " + path);
        }
    }

    private static String validate(String path, String prefix, Class<?> kind) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(prefix, "prefix");
        if (!path.isEmpty() && !path.startsWith(prefix)) {
            throw new DatatrackerException.InvalidUri(
                    kind.getSimpleName() + " must start with " + prefix + ": " + path);
        }
        return path;
    }

    @Override
    public int compareTo(ResourceUri o) {
        int byKind = kind().compareTo(o.kind());
        return byKind != 0 ? byKind : path.compareTo(o.path);
    }

    @Override
    public final boolean equals(Object other) {
        if (this == other) return true;
        if (other == null || other.getClass() != getClass()) return false;
        return path.equals(((ResourceUri) other).path);
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().hashCode() + path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
