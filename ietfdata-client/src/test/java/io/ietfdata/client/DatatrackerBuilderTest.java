package io.ietfdata.client;

import io.ietfdata.core.group.GroupState;
import io.ietfdata.core.group.GroupStateUri;
import io.ietfdata.http.spi.HttpClientAdapter;
import io.ietfdata.http.spi.HttpClientRequest;
import io.ietfdata.http.spi.HttpClientResponse;
import io.ietfdata.json.spi.JsonCodec;
import io.ietfdata.json.spi.JsonCodecProvider;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

class DatatrackerBuilderTest {

    private static final String ACTIVE = "{\"resource_uri\":\"/api/v1/name/groupstatename/active/\",\"slug\":\"active\","
            + "\"name\":\"Active\",\"desc\":\"\",\"used\":true,\"order\":0}";

    @Test
    void builderUsesCustomAdapterAndDefaultConfig() {
        RecordingAdapter http = new RecordingAdapter(ACTIVE);

        Datatracker dt = Datatracker.builder()
                .httpClient(http)
                .build();
        GroupState state = dt.groupState(GroupStateUri.of("active"));

        assertThat(state.slug()).isEqualTo("active");
        assertThat(dt.config().pageSize()).isEqualTo(DatatrackerConfig.DEFAULT_PAGE_SIZE);
        assertThat(http.lastRequest.uri())
                .isEqualTo(URI.create("https://datatracker.ietf.org/api/v1/name/groupstatename/active/"));
    }

    @Test
    void builderUsesExplicitCodec() {
        RecordingAdapter http = new RecordingAdapter(ACTIVE);
        JsonCodec codec = ServiceLoader.load(JsonCodecProvider.class).findFirst().orElseThrow().codec();

        Datatracker dt = Datatracker.builder()
                .config(DatatrackerConfig.builder().origin(URI.create("http://mirror.example:8080")).build())
                .httpClient(http)
                .codec(codec)
                .build();
        dt.groupState(GroupStateUri.of("active"));

        assertThat(http.lastRequest.uri().getAuthority()).isEqualTo("mirror.example:8080");
    }

    @Test
    void collectionMethodsDoNotTouchTheNetwork() {
        RecordingAdapter http = new RecordingAdapter(ACTIVE);

        Datatracker dt = Datatracker.builder().httpClient(http).build();
        PaginatedSequence<GroupState> states = dt.groupStates();

        assertThat(http.lastRequest).isNull();
        assertThat(states.firstPage())
                .isEqualTo(URI.create("https://datatracker.ietf.org/api/v1/name/groupstatename/?limit=100"));
    }

    private static final class RecordingAdapter implements HttpClientAdapter {
        private final byte[] body;
        private HttpClientRequest lastRequest;

        RecordingAdapter(String body) {
            this.body = body.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public HttpClientResponse send(HttpClientRequest request) {
            lastRequest = request;
            return new HttpClientResponse() {
                @Override public int statusCode() { return 200; }
                @Override public Optional<String> header(String name) { return Optional.empty(); }
                @Override public byte[] body() { return body; }
            };
        }
    }
}
