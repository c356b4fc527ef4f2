package io.ietfdata.client;

import java.net.URI;

/**
 * Issues single GET requests against absolute Datatracker URLs and decodes the responses.
 *
 * <p>Each call is exactly one round trip and either returns a value or throws one
 * {@link io.ietfdata.core.DatatrackerException}: {@code NotFound} for any non-2xx status,
 * {@code Transport} when the request fails or the body does not decode. Nothing is retried.
 * Implementations are thread-safe.
 */
public interface ResourceClient {

    <T> T fetchOne(URI url, Class<T> type);

    <T> PageEnvelope<T> fetchPage(URI url, Class<T> type);
}
