package io.ietfdata.json.spi;

/**
 * Minimal JSON codec interface for decoding Datatracker responses.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Single resources decode straight into strongly-typed records with {@link #readValue}. Collection
 * envelopes are read as a tree with {@link #readTree} so the caller can pick the metadata apart and
 * convert each item with {@link JsonNode#toObject(Class)}.
 */
public interface JsonCodec {

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the data is not valid JSON or does not match {@code type}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Parses JSON bytes into a tree.
     * @param data JSON bytes
     * @return the root node
     * @throws JsonException if the data is not valid JSON
     */
    JsonNode readTree(byte[] data) throws JsonException;
}
