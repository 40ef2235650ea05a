package io.tessera.coordination.event;

import io.tessera.core.signal.Signal;
import io.tessera.core.signal.SignalAck;
import java.time.Duration;
import java.time.Instant;

/// Events emitted by the signal protocol and the activity monitor.
///
/// @see CoordinationListener
public sealed interface CoordinationEvent {

    /// Returns when the event occurred.
    ///
    /// @return event timestamp, never null
    Instant timestamp();

    /// A signal was written to its receiver's slot.
    record SignalSent(Signal signal, Instant timestamp) implements CoordinationEvent {}

    /// A send was recognized as a duplicate through its idempotency record and skipped.
    record DuplicateSignalSuppressed(String messageId, String signalId, Instant timestamp)
            implements CoordinationEvent {}

    /// A coordinator acknowledged a signal.
    record SignalAcknowledged(SignalAck ack, Instant timestamp) implements CoordinationEvent {}

    /// A stored acknowledgment failed signature verification and was treated as missing.
    record AckRejected(String coordinatorId, String signalId, Instant timestamp)
            implements CoordinationEvent {}

    /// An acknowledgment retry attempt started.
    record AckRetryAttempted(String coordinatorId, String signalId, int attempt, Instant timestamp)
            implements CoordinationEvent {}

    /// Every acknowledgment retry failed.
    record AckRetryExhausted(
            String coordinatorId, String signalId, int attempts, String error, Instant timestamp)
            implements CoordinationEvent {}

    /// A coordinator has been inactive for longer than the threshold.
    ///
    /// @param coordinatorId the inactive coordinator
    /// @param inactiveFor time since its last recorded activity
    /// @param iteration iteration reported with the last activity
    /// @param phase phase reported with the last activity, may be null
    /// @param reason human-readable description
    /// @param timestamp when the timeout was detected
    record CoordinatorTimedOut(
            String coordinatorId,
            Duration inactiveFor,
            int iteration,
            String phase,
            String reason,
            Instant timestamp)
            implements CoordinationEvent {}

    /// State of a timed-out coordinator was removed.
    record CleanupCompleted(String coordinatorId, int keysRemoved, Instant timestamp)
            implements CoordinationEvent {}

    /// Removing a timed-out coordinator's state failed.
    record CleanupFailed(String coordinatorId, String error, Instant timestamp)
            implements CoordinationEvent {}
}
