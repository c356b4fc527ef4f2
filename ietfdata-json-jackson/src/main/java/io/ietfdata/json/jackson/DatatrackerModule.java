package io.ietfdata.json.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.ietfdata.core.DatatrackerException;
import io.ietfdata.core.ResourceUri;
import io.ietfdata.core.ResourceUris;
import io.ietfdata.core.Timestamps;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Jackson module for Datatracker scalar types.
 *
 * <p>Installs one deserializer per {@link ResourceUri} kind listed in {@link ResourceUris}, so a
 * path string decodes into the reference type the record component declares, and an
 * {@link Instant} deserializer for offset-less UTC timestamps.
 */
public final class DatatrackerModule extends SimpleModule {

    public DatatrackerModule() {
        super("DatatrackerModule");
        for (Class<? extends ResourceUri> kind : ResourceUris.kinds()) {
            register(kind);
        }
        addDeserializer(Instant.class, new UtcTimestampDeserializer());
    }

    private <U extends ResourceUri> void register(Class<U> kind) {
        addDeserializer(kind, new ResourceUriDeserializer<>(kind));
    }

    static final class ResourceUriDeserializer<U extends ResourceUri> extends StdScalarDeserializer<U> {
        private final Class<U> kind;

        ResourceUriDeserializer(Class<U> kind) {
            super(kind);
            this.kind = kind;
        }

        @Override
        public U deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_STRING) {
                return kind.cast(ctxt.handleUnexpectedToken(kind, p));
            }
            String path = p.getText();
            try {
                return ResourceUris.parse(kind, path);
            } catch (DatatrackerException.InvalidUri e) {
                return kind.cast(ctxt.handleWeirdStringValue(kind, path, "%s", e.getMessage()));
            }
        }
    }

    static final class UtcTimestampDeserializer extends StdScalarDeserializer<Instant> {

        UtcTimestampDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_STRING) {
                return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
            }
            String text = p.getText();
            try {
                return Timestamps.parse(text);
            } catch (DateTimeParseException e) {
                return (Instant) ctxt.handleWeirdStringValue(Instant.class, text, "not a Datatracker timestamp: %s", e.getMessage());
            }
        }
    }
}
