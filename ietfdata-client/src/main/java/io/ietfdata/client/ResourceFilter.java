package io.ietfdata.client;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.Timestamps;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Query filters for the people, documents and groups collections, fixed before the first request.
 *
 * <pre>{@code
 * ResourceFilter filter = ResourceFilter.builder()
 *         .nameContains("Perkins")
 *         .since(Instant.parse("2019-01-01T00:00:00Z"))
 *         .build();
 * }</pre>
 */
public final class ResourceFilter {

    private static final ResourceFilter NONE = new Builder().build();

    private final String name;
    private final String nameContains;
    private final Instant since;
    private final Instant until;

    private ResourceFilter(Builder b) {
        this.name = b.name;
        this.nameContains = b.nameContains;
        this.since = b.since;
        this.until = b.until;
        if (since != null && until != null && since.isAfter(until)) {
            throw new IllegalArgumentException("since (" + since + ") is after until (" + until + ")");
        }
    }

    public static ResourceFilter none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> name() { return Optional.ofNullable(name); }
    public Optional<String> nameContains() { return Optional.ofNullable(nameContains); }
    /** Inclusive lower bound on the record's {@code time}, rounded up to a whole second when sent. */
    public Optional<Instant> since() { return Optional.ofNullable(since); }
    /** Exclusive upper bound on the record's {@code time}, truncated to a whole second when sent. */
    public Optional<Instant> until() { return Optional.ofNullable(until); }

    /**
     * Query parameters for this filter, in no particular order.
     *
     * <p>The server only accepts whole seconds. Both bounds are moved inwards so the query never
     * matches a record outside the requested range.
     */
    Map<String, String> toQuery() {
        Map<String, String> query = new LinkedHashMap<>();
        if (name != null) query.put(Protocol.Q_NAME, name);
        if (nameContains != null) query.put(Protocol.Q_NAME_CONTAINS, nameContains);
        if (since != null) query.put(Protocol.Q_TIME_GTE, Timestamps.format(roundUpToSecond(since)));
        if (until != null) query.put(Protocol.Q_TIME_LT, Timestamps.format(until));
        return query;
    }

    private static Instant roundUpToSecond(Instant t) {
        Instant whole = t.truncatedTo(ChronoUnit.SECONDS);
        return whole.equals(t) ? t : whole.plusSeconds(1);
    }

    @Override
    public String toString() {
        return "ResourceFilter" + toQuery();
    }

    public static final class Builder {
        private String name;
        private String nameContains;
        private Instant since;
        private Instant until;

        private Builder() {}

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder nameContains(String fragment) {
            this.nameContains = Objects.requireNonNull(fragment, "fragment");
            return this;
        }

        public Builder since(Instant since) {
            this.since = Objects.requireNonNull(since, "since");
            return this;
        }

        public Builder until(Instant until) {
            this.until = Objects.requireNonNull(until, "until");
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code since} is after {@code until}
         */
        public ResourceFilter build() {
            return new ResourceFilter(this);
        }
    }
}
