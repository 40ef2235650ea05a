package io.tessera.coordination.signal;

/// Outcome of {@link SignalAckProtocol#sendSignal}.
///
/// @param messageId identifier of this send, unique per timestamp
/// @param signalId identifier of the logical signal, shared by retried sends
/// @param duplicate `true` if the send was recognized as already delivered and
///        nothing was written
public record SendResult(String messageId, String signalId, boolean duplicate) {}
