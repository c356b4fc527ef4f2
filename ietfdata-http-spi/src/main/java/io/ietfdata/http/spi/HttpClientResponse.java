package io.ietfdata.http.spi;

import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 */
public interface HttpClientResponse {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    default boolean isSuccess() {
        int status = statusCode();
        return status >= 200 && status < 300;
    }

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body.
     * @return the body bytes, never null (empty when the response had no body)
     */
    byte[] body();
}
