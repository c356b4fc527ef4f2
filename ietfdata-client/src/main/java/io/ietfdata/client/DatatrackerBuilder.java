package io.ietfdata.client;

import io.ietfdata.http.spi.HttpClientAdapter;
import io.ietfdata.http.spi.JdkHttpClientAdapter;
import io.ietfdata.json.spi.JsonCodec;
import io.ietfdata.json.spi.JsonCodecProvider;

import java.net.http.HttpClient;
import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Builder for {@link Datatracker}.
 *
 * <p>Without an explicit adapter the JDK {@link HttpClient} is used. Without an explicit codec the first
 * {@link JsonCodecProvider} found through {@link ServiceLoader} supplies one.
 */
public final class DatatrackerBuilder {
    private DatatrackerConfig config;
    private HttpClientAdapter http;
    private JsonCodec codec;

    DatatrackerBuilder() {}

    public DatatrackerBuilder config(DatatrackerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public DatatrackerBuilder httpClient(HttpClientAdapter http) {
        this.http = Objects.requireNonNull(http, "http");
        return this;
    }

    public DatatrackerBuilder jdkHttpClient(HttpClient httpClient) {
        this.http = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public DatatrackerBuilder codec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    /**
     * @throws IllegalStateException if no codec was set and none is registered
     */
    public Datatracker build() {
        DatatrackerConfig resolvedConfig = config == null ? DatatrackerConfig.defaults() : config;
        HttpClientAdapter resolvedHttp = http;
        if (resolvedHttp == null) {
            resolvedHttp = JdkHttpClientAdapter.create(HttpClient.newBuilder()
                    .connectTimeout(resolvedConfig.requestTimeout())
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build());
        }
        JsonCodec resolvedCodec = codec == null ? loadCodec() : codec;
        return new Datatracker(resolvedConfig, new HttpResourceClient(resolvedHttp, resolvedCodec, resolvedConfig));
    }

    private static JsonCodec loadCodec() {
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class).iterator();
        if (!providers.hasNext()) {
            throw new IllegalStateException("No JsonCodecProvider on the classpath; add ietfdata-json-jackson or set a codec");
        }
        return providers.next().codec();
    }
}
