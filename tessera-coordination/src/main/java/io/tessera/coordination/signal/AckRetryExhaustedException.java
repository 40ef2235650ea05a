package io.tessera.coordination.signal;

import java.io.Serial;

/// Thrown when {@link SignalAckProtocol#retryFailedSignal} runs out of attempts.
///
/// The failure is also recorded under `retry:{signalId}:failed`.
public class AckRetryExhaustedException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2467094313306671172L;

    private final String coordinatorId;
    private final String signalId;
    private final int attempts;

    public AckRetryExhaustedException(
            String coordinatorId, String signalId, int attempts, Throwable cause) {
        super(
                "Acknowledgment of signal "
                        + signalId
                        + " by "
                        + coordinatorId
                        + " failed after "
                        + attempts
                        + " attempt(s)",
                cause);
        this.coordinatorId = coordinatorId;
        this.signalId = signalId;
        this.attempts = attempts;
    }

    public String getCoordinatorId() {
        return coordinatorId;
    }

    public String getSignalId() {
        return signalId;
    }

    public int getAttempts() {
        return attempts;
    }
}
