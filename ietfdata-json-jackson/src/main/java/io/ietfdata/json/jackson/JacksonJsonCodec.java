package io.ietfdata.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.ietfdata.json.spi.JsonCodec;
import io.ietfdata.json.spi.JsonException;
import io.ietfdata.json.spi.JsonNode;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Decodes Datatracker payloads into the entity records of {@code ietfdata-core}.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the mapper from {@link #defaultMapper()}.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * The mapper must already know how to decode resource references and timestamps,
     * e.g. by registering {@link DatatrackerModule}.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Mapper configured for the Datatracker wire format: snake_case property names, {@code Optional}
     * support, typed resource references, UTC timestamps, and tolerance for fields this client does not model.
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new Jdk8Module())
                .addModule(new DatatrackerModule())
                .propertyNamingStrategy(new DatatrackerNamingStrategy())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build();
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        T value;
        try {
            value = mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type.getName(), e);
        }
        if (value == null) {
            throw new JsonException("Expected " + type.getName() + " but got JSON null");
        }
        return value;
    }

    @Override
    public JsonNode readTree(byte[] data) throws JsonException {
        try {
            return new JacksonJsonNode(mapper.readTree(data), mapper);
        } catch (Exception e) {
            throw new JsonException("Failed to parse bytes to tree", e);
        }
    }
}
