package io.ietfdata.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the Datatracker client to work with different
 * HTTP client libraries (JDK HttpClient, Apache HttpClient, OkHttp, etc.)
 * without direct dependency on any specific implementation.
 *
 * <p>Implementations must be thread-safe and reusable; one adapter is shared by every request and
 * every paginated sequence derived from a client. Adapters never retry.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("https://datatracker.ietf.org/api/v1/")).build();
 * HttpClientResponse response = adapter.send(request);
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns the response with the whole body read into memory.
     *
     * @param request the HTTP request to send
     * @return the HTTP response, whatever its status
     * @throws HttpClientException if the request could not be completed
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
