package io.tessera.coordination.signal;

import io.tessera.core.signal.SignalAck;
import java.util.List;
import java.util.Map;

/// Result of {@link SignalAckProtocol#waitForAcks}.
///
/// @param acks verified acknowledgments keyed by coordinator id, in request order
/// @param missing coordinators without a verified acknowledgment, in request order
public record AckCollection(Map<String, SignalAck> acks, List<String> missing) {

    public AckCollection {
        acks = Map.copyOf(acks);
        missing = List.copyOf(missing);
    }

    public boolean complete() {
        return missing.isEmpty();
    }
}
