package io.ietfdata.client;

import java.util.List;
import java.util.Objects;

/**
 * One decoded page of a collection: its metadata and its items in server order.
 */
public record PageEnvelope<T>(PageMeta meta, List<T> objects) {
    public PageEnvelope {
        Objects.requireNonNull(meta, "meta");
        objects = objects == null ? List.of() : List.copyOf(objects);
    }
}
