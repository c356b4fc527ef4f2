package io.ietfdata.client;

import io.ietfdata.core.DatatrackerException;
import io.ietfdata.core.Protocol;
import io.ietfdata.http.spi.HttpClientAdapter;
import io.ietfdata.http.spi.HttpClientException;
import io.ietfdata.http.spi.HttpClientRequest;
import io.ietfdata.http.spi.HttpClientResponse;
import io.ietfdata.json.spi.JsonCodec;
import io.ietfdata.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ResourceClient} over an {@link HttpClientAdapter} and a {@link JsonCodec}.
 */
public final class HttpResourceClient implements ResourceClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpResourceClient.class);

    private final HttpClientAdapter http;
    private final JsonCodec codec;
    private final Duration timeout;
    private final String userAgent;

    public HttpResourceClient(HttpClientAdapter http, JsonCodec codec, DatatrackerConfig config) {
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(config, "config");
        this.timeout = config.requestTimeout();
        this.userAgent = config.userAgent();
    }

    @Override
    public <T> T fetchOne(URI url, Class<T> type) {
        byte[] body = get(url);
        try {
            return codec.readValue(body, type);
        } catch (JsonException e) {
            LOG.debug("GET {} returned a body that is not a {}", url, type.getSimpleName(), e);
            throw new DatatrackerException.Transport(url, e);
        }
    }

    @Override
    public <T> PageEnvelope<T> fetchPage(URI url, Class<T> type) {
        byte[] body = get(url);
        try {
            return PageEnvelopes.decode(codec.readTree(body), type);
        } catch (JsonException e) {
            LOG.debug("GET {} returned a body that is not a page of {}", url, type.getSimpleName(), e);
            throw new DatatrackerException.Transport(url, e);
        }
    }

    private byte[] get(URI url) {
        Objects.requireNonNull(url, "url");
        HttpClientRequest request = HttpClientRequest.get(url)
                .header(Protocol.H_ACCEPT, Protocol.CT_JSON)
                .header(Protocol.H_USER_AGENT, userAgent)
                .timeout(timeout)
                .build();

        HttpClientResponse response;
        try {
            response = http.send(request);
        } catch (HttpClientException e) {
            LOG.debug("GET {} failed", url, e);
            throw new DatatrackerException.Transport(url, e);
        }

        LOG.debug("GET {} -> {}", url, response.statusCode());
        if (!response.isSuccess()) {
            throw new DatatrackerException.NotFound(url, response.statusCode());
        }
        return response.body();
    }
}
