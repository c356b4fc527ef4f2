package io.ietfdata.json.spi;

import java.util.Iterator;

/**
 * Abstraction for a read-only JSON tree node. Represents any JSON value (object, array, string,
 * number, boolean, null) without exposing the underlying JSON library.
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    /**
     * Returns true for an explicit JSON {@code null}.
     */
    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Returns true when a looked-up field does not exist.
     */
    default boolean isMissing() {
        return getNodeType() == JsonNodeType.MISSING;
    }

    /**
     * Gets a field by name from an object node.
     * Returns a {@link JsonNodeType#MISSING} node if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Returns true if this node has a field with the given name.
     */
    boolean has(String fieldName);

    /**
     * Returns the size of this node.
     * For objects: number of fields
     * For arrays: number of elements
     * For others: 0
     */
    int size();

    /**
     * Returns the text value of this node, or its string representation for non-text nodes.
     */
    String asText();

    /**
     * Returns the long value of this node.
     * For numeric nodes: the long value
     * For text nodes: parsed long, or 0 if not a number
     * For others: 0
     */
    long asLong();

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();

    /**
     * Converts this node to a Java object of the specified type.
     * @throws JsonException if conversion fails
     */
    <T> T toObject(Class<T> type) throws JsonException;
}
