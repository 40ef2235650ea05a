package io.tessera.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Reads enum constants case-insensitively; `security-specialist` style dashes map
/// to underscores.
///
/// @implNote Package-private. Registered by {@link TesseraJacksonModule}.
class WireEnumDeserializer<E extends Enum<E>> extends StdDeserializer<E> {

    @Serial private static final long serialVersionUID = -1380964471855210528L;

    private final Class<E> enumType;

    WireEnumDeserializer(Class<E> enumType) {
        super(enumType);
        this.enumType = enumType;
    }

    @Override
    public E deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String text = p.getValueAsString();
        if (text == null || text.isBlank()) {
            return (E) ctxt.handleWeirdStringValue(enumType, text, "empty enum value");
        }
        String constant = text.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(enumType, constant);
        } catch (IllegalArgumentException e) {
            return (E)
                    ctxt.handleWeirdStringValue(
                            enumType, text, "not one of " + enumType.getSimpleName() + " values");
        }
    }
}
