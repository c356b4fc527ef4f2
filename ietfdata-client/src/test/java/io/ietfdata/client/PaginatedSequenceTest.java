package io.ietfdata.client;

import io.ietfdata.core.DatatrackerException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginatedSequenceTest {

    private static final URI ORIGIN = URI.create("https://datatracker.example");
    private static final String PATH = "/api/v1/person/email/";
    private static final URI FIRST = URI.create(ORIGIN + PATH + "?limit=2");

    @Test
    void fiveItemsOverThreePagesAreFetchedLazily() {
        RecordingClient client = new RecordingClient()
                .page(FIRST, 5, List.of("a", "b"), PATH + "?limit=2&offset=2")
                .page(url("?limit=2&offset=2"), 5, List.of("c", "d"), PATH + "?limit=2&offset=4")
                .page(url("?limit=2&offset=4"), 5, List.of("e"), null);

        Iterator<String> it = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class).iterator();
        List<String> firstThree = List.of(it.next(), it.next(), it.next());

        assertThat(firstThree).containsExactly("a", "b", "c");
        assertThat(client.fetched).hasSizeLessThanOrEqualTo(2);

        List<String> rest = new ArrayList<>();
        it.forEachRemaining(rest::add);

        assertThat(rest).containsExactly("d", "e");
        assertThat(client.fetched).containsExactly(FIRST, url("?limit=2&offset=2"), url("?limit=2&offset=4"));
    }

    @Test
    void nothingIsFetchedUntilIterated() {
        RecordingClient client = new RecordingClient().page(FIRST, 1, List.of("a"), null);

        PaginatedSequence<String> seq = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class);
        Iterator<String> it = seq.iterator();

        assertThat(client.fetched).isEmpty();
        assertThat(it.hasNext()).isTrue();
        assertThat(client.fetched).containsExactly(FIRST);
    }

    @Test
    void singlePageYieldsItsObjectsInServerOrder() {
        RecordingClient client = new RecordingClient().page(FIRST, 3, List.of("z", "a", "m"), null);

        List<String> items = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class).stream()
                .collect(Collectors.toList());

        assertThat(items).containsExactly("z", "a", "m");
        assertThat(client.fetched).hasSize(1);
    }

    @Test
    void emptyCollectionYieldsNothing() {
        RecordingClient client = new RecordingClient().page(FIRST, 0, List.of(), null);

        Iterator<String> it = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class).iterator();

        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void emptyPageWithCursorIsSkipped() {
        RecordingClient client = new RecordingClient()
                .page(FIRST, 1, List.of(), PATH + "?limit=2&offset=2")
                .page(url("?limit=2&offset=2"), 1, List.of("a"), null);

        List<String> items = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class).stream()
                .collect(Collectors.toList());

        assertThat(items).containsExactly("a");
    }

    @Test
    void pageErrorIsYieldedOnceThenSequenceEnds() {
        DatatrackerException.NotFound failure = new DatatrackerException.NotFound(url("?limit=2&offset=2"), 500);
        RecordingClient client = new RecordingClient()
                .page(FIRST, 5, List.of("a", "b"), PATH + "?limit=2&offset=2")
                .failure(url("?limit=2&offset=2"), failure)
                .page(url("?limit=2&offset=4"), 5, List.of("e"), null);

        Iterator<String> it = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class).iterator();

        assertThat(it.next()).isEqualTo("a");
        assertThat(it.next()).isEqualTo("b");
        assertThat(it.hasNext()).isTrue();
        assertThatThrownBy(it::next).isSameAs(failure);
        assertThat(it.hasNext()).isFalse();
        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
        assertThat(client.fetched).hasSize(2);
    }

    @Test
    void firstPageErrorIsThrownFromStream() {
        DatatrackerException.Transport failure = new DatatrackerException.Transport(FIRST, new IllegalStateException("boom"));
        RecordingClient client = new RecordingClient().failure(FIRST, failure);

        PaginatedSequence<String> seq = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class);

        assertThatThrownBy(() -> seq.stream().collect(Collectors.toList())).isSameAs(failure);
    }

    @Test
    void malformedCursorYieldsThePageThenEndsWithTransportError() {
        RecordingClient client = new RecordingClient()
                .page(FIRST, 4, List.of("a", "b"), "/api/v1/person/email/?limit=2&offset=2 oops");

        Iterator<String> it = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class).iterator();

        assertThat(it.next()).isEqualTo("a");
        assertThat(it.next()).isEqualTo("b");
        assertThat(it.hasNext()).isTrue();
        assertThatThrownBy(it::next)
                .isInstanceOf(DatatrackerException.Transport.class)
                .satisfies(e -> assertThat(((DatatrackerException.Transport) e).uri()).isEqualTo(FIRST));
        assertThat(it.hasNext()).isFalse();
        assertThat(client.fetched).containsExactly(FIRST);
    }

    @Test
    void malformedCursorOnEmptyPageIsReportedImmediately() {
        RecordingClient client = new RecordingClient()
                .page(FIRST, 4, List.of(), "not a uri");

        Iterator<String> it = new PaginatedSequence<>(client, ORIGIN, FIRST, String.class).iterator();

        assertThat(it.hasNext()).isTrue();
        assertThatThrownBy(it::next).isInstanceOf(DatatrackerException.Transport.class);
        assertThat(it.hasNext()).isFalse();
    }

    @Test
    void iteratorCanOnlyBeTakenOnce() {
        PaginatedSequence<String> seq = new PaginatedSequence<>(new RecordingClient(), ORIGIN, FIRST, String.class);
        seq.iterator();

        assertThatThrownBy(seq::iterator)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been iterated");
        assertThatThrownBy(seq::stream).isInstanceOf(IllegalStateException.class);
    }

    private static URI url(String query) {
        return URI.create(ORIGIN + PATH + query);
    }

    private static final class RecordingClient implements ResourceClient {
        private final Map<URI, Object> responses = new HashMap<>();
        private final List<URI> fetched = new ArrayList<>();

        RecordingClient page(URI url, long total, List<String> objects, String next) {
            PageMeta meta = new PageMeta(total, 2, 0, Optional.empty(), Optional.ofNullable(next));
            responses.put(url, new PageEnvelope<>(meta, objects));
            return this;
        }

        RecordingClient failure(URI url, DatatrackerException error) {
            responses.put(url, error);
            return this;
        }

        @Override
        public <T> T fetchOne(URI url, Class<T> type) {
            throw new UnsupportedOperationException();
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> PageEnvelope<T> fetchPage(URI url, Class<T> type) {
            fetched.add(url);
            Object response = responses.get(url);
            if (response == null) {
                throw new AssertionError("unexpected request " + url);
            }
            if (response instanceof DatatrackerException) {
                throw (DatatrackerException) response;
            }
            return (PageEnvelope<T>) response;
        }
    }
}
