package io.ietfdata.http.spi;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        OkHttpClient client = clientWithTimeout(request);
        Request okRequest = toOkHttpRequest(request);
        try (Response response = client.newCall(okRequest).execute()) {
            return BufferedResponse.of(response);
        } catch (InterruptedIOException e) {
            // SocketTimeoutException and OkHttp's call timeout both land here
            throw new HttpTimeoutException(e);
        } catch (IOException e) {
            throw new HttpClientException(e);
        }
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);
        builder.method(request.method(), null);

        return builder.build();
    }

    private static final class BufferedResponse implements HttpClientResponse {
        private final int statusCode;
        private final Map<String, String> headers;
        private final byte[] body;

        private BufferedResponse(int statusCode, Map<String, String> headers, byte[] body) {
            this.statusCode = statusCode;
            this.headers = headers;
            this.body = body;
        }

        static BufferedResponse of(Response response) throws IOException {
            Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            for (String name : response.headers().names()) {
                headers.put(name, response.header(name));
            }
            ResponseBody responseBody = response.body();
            byte[] body = responseBody != null ? responseBody.bytes() : new byte[0];
            return new BufferedResponse(response.code(), headers, body);
        }

        @Override public int statusCode() { return statusCode; }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(headers.get(name)); }
        @Override public byte[] body() { return body; }
    }
}
