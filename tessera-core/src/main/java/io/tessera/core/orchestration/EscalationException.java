package io.tessera.core.orchestration;

import java.io.Serial;

/// Thrown by {@link IterationOrchestrator#executePhaseOrThrow} when a phase escalates.
///
/// Carries the full {@link PhaseResult} so the caller can hand it to a human.
public class EscalationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4207155308722196413L;

    private final transient PhaseResult result;

    public EscalationException(PhaseResult result) {
        super("Phase '" + result.phaseId() + "' escalated: " + result.escalationReason());
        this.result = result;
    }

    public PhaseResult getResult() {
        return result;
    }
}
