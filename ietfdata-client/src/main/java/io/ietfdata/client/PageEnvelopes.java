package io.ietfdata.client;

import io.ietfdata.core.Protocol;
import io.ietfdata.json.spi.JsonException;
import io.ietfdata.json.spi.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Decodes collection responses of the form
 * {@code {"meta": {total_count, limit, offset, previous, next}, "objects": [...]}}.
 *
 * <p>Every item must decode; a single bad item fails the whole page.
 */
final class PageEnvelopes {
    private PageEnvelopes() {}

    static <T> PageEnvelope<T> decode(JsonNode root, Class<T> type) throws JsonException {
        if (!root.isObject()) {
            throw new JsonException("page envelope must be a JSON object but was " + root.getNodeType());
        }
        PageMeta meta = decodeMeta(root.get(Protocol.K_META));

        JsonNode objects = root.get(Protocol.K_OBJECTS);
        if (!objects.isArray()) {
            throw new JsonException("page envelope has no '" + Protocol.K_OBJECTS + "' array");
        }
        List<T> items = new ArrayList<>(objects.size());
        int index = 0;
        for (Iterator<JsonNode> it = objects.elements(); it.hasNext(); index++) {
            JsonNode item = it.next();
            try {
                items.add(item.toObject(type));
            } catch (JsonException e) {
                throw new JsonException("object " + index + " of page is not a valid " + type.getSimpleName(), e);
            }
        }
        return new PageEnvelope<>(meta, items);
    }

    private static PageMeta decodeMeta(JsonNode meta) throws JsonException {
        if (!meta.isObject()) {
            throw new JsonException("page envelope has no '" + Protocol.K_META + "' object");
        }
        return new PageMeta(
                number(meta, Protocol.K_TOTAL_COUNT),
                number(meta, Protocol.K_LIMIT),
                number(meta, Protocol.K_OFFSET),
                cursor(meta, Protocol.K_PREVIOUS),
                cursor(meta, Protocol.K_NEXT));
    }

    private static long number(JsonNode meta, String key) throws JsonException {
        JsonNode n = meta.get(key);
        if (!n.isNumber()) {
            throw new JsonException("page meta '" + key + "' must be a number");
        }
        return n.asLong();
    }

    private static Optional<String> cursor(JsonNode meta, String key) throws JsonException {
        JsonNode n = meta.get(key);
        if (n.isMissing() || n.isNull()) {
            return Optional.empty();
        }
        if (!n.isTextual()) {
            throw new JsonException("page meta '" + key + "' must be a string or null");
        }
        String value = n.asText();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
