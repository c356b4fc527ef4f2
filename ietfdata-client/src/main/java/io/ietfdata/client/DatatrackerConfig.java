package io.ietfdata.client;

import io.ietfdata.core.Protocol;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable client settings.
 *
 * <p>Defaults: origin {@value Protocol#DEFAULT_ORIGIN}, page size {@value #DEFAULT_PAGE_SIZE},
 * request timeout 30 seconds, user agent {@value #DEFAULT_USER_AGENT}.
 */
public final class DatatrackerConfig {

    public static final String PROPERTIES_RESOURCE = "ietfdata.properties";
    public static final String KEY_ORIGIN = "ietfdata.origin";
    public static final String KEY_PAGE_SIZE = "ietfdata.page-size";
    public static final String KEY_REQUEST_TIMEOUT = "ietfdata.request-timeout";
    public static final String KEY_USER_AGENT = "ietfdata.user-agent";

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 1000;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "ietfdata-java";

    private final URI origin;
    private final int pageSize;
    private final Duration requestTimeout;
    private final String userAgent;

    private DatatrackerConfig(Builder b) {
        this.origin = validateOrigin(b.origin);
        if (b.pageSize < 1 || b.pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE + ": " + b.pageSize);
        }
        this.pageSize = b.pageSize;
        if (b.requestTimeout.isNegative() || b.requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive: " + b.requestTimeout);
        }
        this.requestTimeout = b.requestTimeout;
        if (b.userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent must not be blank");
        }
        this.userAgent = b.userAgent;
    }

    public static DatatrackerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from {@code ietfdata.*} keys. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static DatatrackerConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String origin = trimmed(props, KEY_ORIGIN);
        if (origin != null) {
            try {
                b.origin(URI.create(origin));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(KEY_ORIGIN + " is not a URI: " + origin, e);
            }
        }
        String pageSize = trimmed(props, KEY_PAGE_SIZE);
        if (pageSize != null) {
            try {
                b.pageSize(Integer.parseInt(pageSize));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(KEY_PAGE_SIZE + " is not an integer: " + pageSize, e);
            }
        }
        String timeout = trimmed(props, KEY_REQUEST_TIMEOUT);
        if (timeout != null) {
            try {
                b.requestTimeout(Duration.parse(timeout));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(KEY_REQUEST_TIMEOUT + " is not an ISO-8601 duration: " + timeout, e);
            }
        }
        String userAgent = trimmed(props, KEY_USER_AGENT);
        if (userAgent != null) {
            b.userAgent(userAgent);
        }
        return b.build();
    }

    /**
     * Reads {@value #PROPERTIES_RESOURCE} from the classpath if present, then applies JVM system
     * properties on top.
     */
    public static DatatrackerConfig load() {
        Properties props = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = DatatrackerConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("ietfdata.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(props);
    }

    public URI origin() { return origin; }
    public int pageSize() { return pageSize; }
    public Duration requestTimeout() { return requestTimeout; }
    public String userAgent() { return userAgent; }

    @Override
    public String toString() {
        return "DatatrackerConfig{origin=" + origin + ", pageSize=" + pageSize
                + ", requestTimeout=" + requestTimeout + ", userAgent=" + userAgent + "}";
    }

    private static URI validateOrigin(URI origin) {
        String scheme = origin.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("origin must be an http or https URI: " + origin);
        }
        if (origin.getHost() == null) {
            throw new IllegalArgumentException("origin has no host: " + origin);
        }
        return origin;
    }

    private static String trimmed(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) return null;
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    public static final class Builder {
        private URI origin = URI.create(Protocol.DEFAULT_ORIGIN);
        private int pageSize = DEFAULT_PAGE_SIZE;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private String userAgent = DEFAULT_USER_AGENT;

        private Builder() {}

        public Builder origin(URI origin) {
            this.origin = Objects.requireNonNull(origin, "origin");
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
            return this;
        }

        public DatatrackerConfig build() {
            return new DatatrackerConfig(this);
        }
    }
}
