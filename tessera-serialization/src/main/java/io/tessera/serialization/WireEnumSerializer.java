package io.tessera.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Writes enum constants as their lowercase wire name.
///
/// @implNote Package-private. Registered by {@link TesseraJacksonModule}.
/// @see WireEnumDeserializer for the inverse operation
class WireEnumSerializer<E extends Enum<E>> extends StdSerializer<E> {

    @Serial private static final long serialVersionUID = 6601349711203914127L;

    WireEnumSerializer(Class<E> type) {
        super(type);
    }

    @Override
    public void serialize(E value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(value.name().toLowerCase(Locale.ROOT));
    }
}
