package io.ietfdata.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every {@link HttpClientAdapter} must share, run against a local MockWebServer.
 */
abstract class HttpClientAdapterContractTest {

    protected MockWebServer server;

    protected abstract HttpClientAdapter adapter();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void getReturnsStatusHeadersAndBody() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"objects\":[]}"));

        HttpClientResponse response = adapter().send(HttpClientRequest.get(uri("/api/v1/person/person/"))
                .header("Accept", "application/json")
                .header("User-Agent", "ietfdata-test")
                .timeout(Duration.ofSeconds(5))
                .build());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.header("content-type")).contains("application/json");
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("{\"objects\":[]}");

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/api/v1/person/person/");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
        assertThat(recorded.getHeader("User-Agent")).isEqualTo("ietfdata-test");
    }

    @Test
    void queryStringIsSentUnchanged() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));

        adapter().send(HttpClientRequest.get(uri("/api/v1/person/email/?person=%2Fapi%2Fv1%2Fperson%2Fperson%2F20209%2F&limit=2")).build());

        assertThat(server.takeRequest().getPath())
                .isEqualTo("/api/v1/person/email/?person=%2Fapi%2Fv1%2Fperson%2Fperson%2F20209%2F&limit=2");
    }

    @Test
    void errorStatusIsAResponseNotAnException() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpClientResponse response = adapter().send(HttpClientRequest.get(uri("/api/v1/person/email/nobody@example.com/")).build());

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.body()).isNotNull().isEmpty();
        assertThat(response.header("X-Absent")).isEmpty();
    }

    @Test
    void slowResponseTimesOut() {
        server.enqueue(new MockResponse().setBody("{}").setHeadersDelay(2, TimeUnit.SECONDS));

        assertThatThrownBy(() -> adapter().send(HttpClientRequest.get(uri("/slow"))
                .timeout(Duration.ofMillis(200))
                .build()))
                .isInstanceOf(HttpTimeoutException.class);
    }

    @Test
    void unreachableServerFails() throws Exception {
        URI target = uri("/api/v1/");
        server.shutdown();

        assertThatThrownBy(() -> adapter().send(HttpClientRequest.get(target).timeout(Duration.ofSeconds(2)).build()))
                .isInstanceOf(HttpClientException.class);
    }

    protected URI uri(String path) {
        return server.url(path).uri();
    }
}
