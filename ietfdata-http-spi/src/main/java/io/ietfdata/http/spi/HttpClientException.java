package io.ietfdata.http.spi;

/**
 * Exception thrown when an HTTP request could not be completed.
 * Wraps underlying implementation-specific exceptions.
 *
 * <p>A response with a non-2xx status is not an exception at this layer.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpClientException(Throwable cause) {
        super(cause);
    }
}
