package io.ietfdata.client;

import io.ietfdata.core.DatatrackerException;
import io.ietfdata.core.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, forward-only view of a paginated collection.
 *
 * <p>Pages are fetched on demand: nothing is requested until the first call to
 * {@link Iterator#hasNext()}, and the following page is requested only once every item of the current
 * one has been consumed. Items come out in server order with page boundaries invisible. Continuation
 * cursors are resolved against the API origin and used as is.
 *
 * <p>When a page fetch fails, {@code hasNext()} returns {@code true} once more and the following
 * {@code next()} throws that {@link DatatrackerException}. A page whose {@code next} cursor is unusable
 * still yields its own items before the error. The sequence is finished after that; it
 * neither retries nor skips ahead.
 *
 * <p>Like {@link java.nio.file.DirectoryStream}, a sequence supports a single iteration:
 * {@link #iterator()} (or {@link #stream()}) may be called once. Call the endpoint method again to start
 * over from the first page. Not thread-safe.
 *
 * @param <T> the item type
 */
public final class PaginatedSequence<T> implements Iterable<T> {

    private static final Logger LOG = LoggerFactory.getLogger(PaginatedSequence.class);

    private final ResourceClient client;
    private final URI origin;
    private final URI firstPage;
    private final Class<T> type;
    private boolean iterated;

    public PaginatedSequence(ResourceClient client, URI origin, URI firstPage, Class<T> type) {
        this.client = Objects.requireNonNull(client, "client");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.firstPage = Objects.requireNonNull(firstPage, "firstPage");
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * URL of the first page, including the page size and any filter parameters.
     */
    public URI firstPage() {
        return firstPage;
    }

    /**
     * @throws IllegalStateException if this sequence has already been iterated
     */
    @Override
    public Iterator<T> iterator() {
        if (iterated) {
            throw new IllegalStateException("sequence over " + firstPage + " has already been iterated");
        }
        iterated = true;
        return new PageIterator();
    }

    /**
     * Sequential stream over the same single pass as {@link #iterator()}. A page error is thrown from the
     * terminal operation.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private final class PageIterator implements Iterator<T> {
        private Iterator<T> buffer = Collections.emptyIterator();
        private URI nextPage = firstPage;
        private DatatrackerException pending;
        private int pages;

        @Override
        public boolean hasNext() {
            if (buffer.hasNext() || pending != null) {
                return true;
            }
            // an empty page with a cursor is skipped, not treated as the end
            while (nextPage != null) {
                URI url = nextPage;
                nextPage = null;
                PageEnvelope<T> page;
                try {
                    page = client.fetchPage(url, type);
                } catch (DatatrackerException e) {
                    LOG.debug("Sequence over {} ended after {} pages", firstPage, pages, e);
                    pending = e;
                    return true;
                }
                pages++;
                buffer = page.objects().iterator();
                // a bad cursor ends the sequence after this page's items
                try {
                    nextPage = page.meta().next().map(cursor -> resolve(url, cursor)).orElse(null);
                } catch (DatatrackerException e) {
                    LOG.debug("Page {} of {} has an unusable next cursor", pages, firstPage, e);
                    pending = e;
                }
                LOG.debug("Page {} of {} has {} of {} items, next: {}",
                        pages, firstPage, page.objects().size(), page.meta().totalCount(), nextPage);
                if (buffer.hasNext() || pending != null) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            if (buffer.hasNext()) {
                return buffer.next();
            }
            DatatrackerException e = pending;
            pending = null;
            throw e;
        }

        private URI resolve(URI page, String cursor) {
            try {
                return Urls.resolve(origin, cursor);
            } catch (IllegalArgumentException e) {
                throw new DatatrackerException.Transport(page, e);
            }
        }
    }
}
