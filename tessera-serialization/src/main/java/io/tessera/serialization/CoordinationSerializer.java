package io.tessera.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/// Utility class for converting coordination records to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = CoordinationSerializer.toJson(feedback);
/// ConsensusFeedback restored = CoordinationSerializer.fromJson(json, ConsensusFeedback.class);
/// }
///
/// @implNote Thread-safe. The shared mapper is configured once and never mutated.
///
/// @see TesseraJacksonModule for the registered type handlers
public final class CoordinationSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private CoordinationSerializer() {}

    /// Serializes a value to compact JSON.
    ///
    /// @param value the value, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + value.getClass().getSimpleName() + ": " + e.getMessage(),
                    e);
        }
    }

    /// Deserializes a value from JSON.
    ///
    /// @param json JSON text, not null
    /// @param type target type, not null
    /// @return the value, never null
    /// @throws IllegalArgumentException if the JSON does not describe a valid `type`
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for coordination records.
    ///
    /// Registers:
    /// - `TesseraJacksonModule` for wire enum names
    /// - `JavaTimeModule` for `Instant` and `Duration` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new TesseraJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
