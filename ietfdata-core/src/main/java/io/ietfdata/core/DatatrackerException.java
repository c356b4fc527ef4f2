package io.ietfdata.core;

import java.net.URI;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Base class for errors surfaced by the Datatracker client.
 *
 * <p>Every fetch either returns a decoded value or throws exactly one of these. Nothing is retried.
 */
public abstract class DatatrackerException extends RuntimeException {

    protected DatatrackerException(String message) {
        super(message);
    }

    protected DatatrackerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The request completed but did not produce the resource.
     *
     * <p>Any non-2xx status ends up here, so authorization failures, missing resources and server
     * errors are indistinguishable at this layer. A lookup that matched nothing has no status.
     */
    public static class NotFound extends DatatrackerException {
        private final URI uri;
        private final int status;

        public NotFound(URI uri, int status) {
            super("GET " + uri + " returned status " + status);
            this.uri = Objects.requireNonNull(uri, "uri");
            this.status = status;
        }

        public NotFound(URI uri, String reason) {
            super("GET " + uri + ": " + reason);
            this.uri = Objects.requireNonNull(uri, "uri");
            this.status = -1;
        }

        public URI uri() {
            return uri;
        }

        /**
         * HTTP status of the response, or empty when the request succeeded but matched nothing.
         */
        public OptionalInt status() {
            return status < 0 ? OptionalInt.empty() : OptionalInt.of(status);
        }
    }

    /**
     * The request could not be completed, or its body did not decode into the expected shape.
     */
    public static class Transport extends DatatrackerException {
        private final URI uri;

        public Transport(URI uri, Throwable cause) {
            super("GET " + uri + " failed: " + cause.getMessage(), cause);
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        public URI uri() {
            return uri;
        }
    }

    /**
     * A resource reference failed local validation. No request was issued.
     */
    public static class InvalidUri extends DatatrackerException {
        public InvalidUri(String message) {
            super(message);
        }
    }
}
