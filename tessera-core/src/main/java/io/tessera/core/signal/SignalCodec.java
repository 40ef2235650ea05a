package io.tessera.core.signal;

/// Converts signals and acknowledgments to and from their stored text form.
///
/// @see io.tessera.core.store.SharedStore
public interface SignalCodec {

    String encodeSignal(Signal signal);

    /// Decodes a stored signal.
    ///
    /// @param text stored form, not null
    /// @return decoded signal, never null
    /// @throws IllegalArgumentException if the text is not a valid signal
    Signal decodeSignal(String text);

    String encodeAck(SignalAck ack);

    /// Decodes a stored acknowledgment.
    ///
    /// @param text stored form, not null
    /// @return decoded acknowledgment, never null
    /// @throws IllegalArgumentException if the text is not a valid acknowledgment
    SignalAck decodeAck(String text);
}
