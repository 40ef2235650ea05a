package io.tessera.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tessera.core.signal.Signal;
import io.tessera.core.signal.SignalAck;
import io.tessera.core.signal.SignalCodec;
import java.util.Objects;

/// Jackson-based {@link SignalCodec}.
///
/// Signals and acknowledgments are stored as compact JSON with ISO-8601
/// timestamps and lowercase signal types:
/// ```json
/// {"signalId":"sig-...","messageId":"msg-...","type":"complete","source":"loop3",
///  "targets":["loop2"],"iteration":1,"payload":{},"timestamp":"2026-01-01T00:00:00Z"}
/// ```
///
/// @implNote Thread-safe if the supplied mapper is not reconfigured after construction.
public class JacksonSignalCodec implements SignalCodec {

    private final ObjectMapper objectMapper;

    public JacksonSignalCodec() {
        this(CoordinationSerializer.createMapper());
    }

    /// @param objectMapper mapper with {@link TesseraJacksonModule} registered, not null
    public JacksonSignalCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String encodeSignal(Signal signal) {
        return write(signal);
    }

    @Override
    public Signal decodeSignal(String text) {
        return read(text, Signal.class);
    }

    @Override
    public String encodeAck(SignalAck ack) {
        return write(ack);
    }

    @Override
    public SignalAck decodeAck(String text) {
        return read(text, SignalAck.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to encode " + value.getClass().getSimpleName() + ": " + e.getMessage(),
                    e);
        }
    }

    private <T> T read(String text, Class<T> type) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            T value = objectMapper.readValue(text, type);
            if (value == null) {
                throw new IllegalArgumentException("Empty " + type.getSimpleName());
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Invalid " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
