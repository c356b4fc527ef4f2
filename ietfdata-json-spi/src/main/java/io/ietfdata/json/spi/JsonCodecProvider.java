package io.ietfdata.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for {@link JsonCodec} implementations.
 *
 * <p>Implementations register themselves in
 * {@code META-INF/services/io.ietfdata.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Creates a codec configured for Datatracker payloads (snake_case fields, typed resource
     * references, offset-less UTC timestamps).
     */
    JsonCodec codec();
}
