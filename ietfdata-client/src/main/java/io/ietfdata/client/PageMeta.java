package io.ietfdata.client;

import java.util.Optional;

/**
 * Pagination metadata of one collection page.
 *
 * <p>{@code previous} and {@code next} are server-relative cursors that already carry every query
 * parameter needed to fetch the neighbouring page. {@code totalCount} is not checked against the
 * number of objects on the page.
 */
public record PageMeta(long totalCount, long limit, long offset, Optional<String> previous, Optional<String> next) {
    public PageMeta {
        previous = previous == null ? Optional.empty() : previous;
        next = next == null ? Optional.empty() : next;
    }

    public boolean isLast() {
        return next.isEmpty();
    }
}
