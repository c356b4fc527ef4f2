package io.ietfdata.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ietfdata.json.spi.JsonException;
import io.ietfdata.json.spi.JsonNode;
import io.ietfdata.json.spi.JsonNodeType;

import java.util.Iterator;
import java.util.Objects;

/**
 * Jackson implementation of JsonNode.
 * Wraps a Jackson JsonNode and delegates all operations to it.
 */
final class JacksonJsonNode implements JsonNode {
    private final com.fasterxml.jackson.databind.JsonNode delegate;
    private final ObjectMapper mapper;

    JacksonJsonNode(com.fasterxml.jackson.databind.JsonNode delegate, ObjectMapper mapper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public JsonNodeType getNodeType() {
        if (delegate.isMissingNode()) return JsonNodeType.MISSING;
        if (delegate.isObject()) return JsonNodeType.OBJECT;
        if (delegate.isArray()) return JsonNodeType.ARRAY;
        if (delegate.isTextual()) return JsonNodeType.STRING;
        if (delegate.isNumber()) return JsonNodeType.NUMBER;
        if (delegate.isBoolean()) return JsonNodeType.BOOLEAN;
        return JsonNodeType.NULL;
    }

    @Override
    public JsonNode get(String fieldName) {
        return new JacksonJsonNode(delegate.path(fieldName), mapper);
    }

    @Override
    public boolean has(String fieldName) {
        return delegate.has(fieldName);
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public String asText() {
        return delegate.asText();
    }

    @Override
    public long asLong() {
        return delegate.asLong();
    }

    @Override
    public Iterator<JsonNode> elements() {
        Iterator<com.fasterxml.jackson.databind.JsonNode> iter = delegate.elements();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iter.hasNext();
            }

            @Override
            public JsonNode next() {
                return new JacksonJsonNode(iter.next(), mapper);
            }
        };
    }

    @Override
    public <T> T toObject(Class<T> type) throws JsonException {
        T value;
        try {
            value = mapper.treeToValue(delegate, type);
        } catch (Exception e) {
            throw new JsonException("Failed to convert node to " + type.getName(), e);
        }
        if (value == null) {
            throw new JsonException("Expected " + type.getName() + " but got JSON null");
        }
        return value;
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JacksonJsonNode other)) return false;
        return delegate.equals(other.delegate);
    }

    @Override
    public int hashCode() {
        return delegate.hashCode();
    }
}
