package io.tessera.core.signal;

import java.io.Serial;

/// Thrown when an acknowledgment read from the shared store does not carry the
/// signature its fields imply.
///
/// Treated as a potential spoofing attempt. Never caught and ignored by the
/// protocol itself.
public class SignatureVerificationException extends RuntimeException {

    @Serial private static final long serialVersionUID = -1260781432458805318L;

    private final String coordinatorId;
    private final String signalId;

    /// Creates an exception for a forged or corrupted acknowledgment.
    ///
    /// @param coordinatorId coordinator named in the acknowledgment
    /// @param signalId signal named in the acknowledgment
    public SignatureVerificationException(String coordinatorId, String signalId) {
        super(
                String.format(
                        "ACK signature verification failed for coordinator '%s', signal '%s'"
                                + " (possible spoofing)",
                        coordinatorId, signalId));
        this.coordinatorId = coordinatorId;
        this.signalId = signalId;
    }

    public String getCoordinatorId() {
        return coordinatorId;
    }

    public String getSignalId() {
        return signalId;
    }
}
