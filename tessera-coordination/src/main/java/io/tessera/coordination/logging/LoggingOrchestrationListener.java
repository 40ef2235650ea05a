package io.tessera.coordination.logging;

import io.tessera.core.breaker.CircuitBreakerEvent;
import io.tessera.core.breaker.CircuitBreakerListener;
import io.tessera.core.orchestration.OrchestrationEvent;
import io.tessera.core.orchestration.OrchestrationListener;
import java.util.Locale;
import org.jboss.logging.Logger;

/// Writes orchestration and circuit breaker events to the JBoss log.
///
/// ### Log Format
/// ```
/// [phaseId] OUTER 2/10 started
/// [phaseId] confidence gate PASS 0.82 (threshold 0.75)
/// [phaseId] consensus gate FAIL 0.67 (threshold 0.90, mode simple)
/// [phaseId] decision PROCEED confidence=0.90
/// [circuit] CLOSED -> OPEN, trips=1
/// ```
///
/// Round progress is logged at INFO, escalations and breaker trips at WARN, call
/// outcomes at DEBUG. Free text such as prompts and reasons passes through
/// {@link LogSanitizer}.
///
/// @implNote Stateless and thread-safe.
public class LoggingOrchestrationListener implements OrchestrationListener, CircuitBreakerListener {

    private static final Logger LOG = Logger.getLogger(LoggingOrchestrationListener.class);

    @Override
    public void onEvent(OrchestrationEvent event) {
        String phase = LogSanitizer.sanitize(event.phaseId());
        if (event instanceof OrchestrationEvent.PhaseStarted) {
            LOG.infov("[{0}] phase started", phase);
        } else if (event instanceof OrchestrationEvent.IterationStarted e) {
            LOG.infov("[{0}] {1} {2}/{3} started", phase, e.loop(), e.iteration(), e.maxIterations());
        } else if (event instanceof OrchestrationEvent.ConfidenceGateEvaluated e) {
            LOG.infov(
                    "[{0}] confidence gate {1} {2} (threshold {3}), low={4}",
                    phase,
                    e.result().passed() ? "PASS" : "FAIL",
                    format(e.result().overallConfidence()),
                    format(e.result().threshold()),
                    e.result().lowConfidenceAgents());
        } else if (event instanceof OrchestrationEvent.ConsensusGateEvaluated e) {
            LOG.infov(
                    "[{0}] consensus gate {1} {2} (threshold {3}, mode {4})",
                    phase,
                    e.result().passed() ? "PASS" : "FAIL",
                    format(e.result().score()),
                    format(e.result().threshold()),
                    e.result().mode());
        } else if (event instanceof OrchestrationEvent.MaliciousAgentDetected e) {
            LOG.warnv("[{0}] malicious agent flagged: {1}", phase, LogSanitizer.sanitize(e.report().summary()));
        } else if (event instanceof OrchestrationEvent.FeedbackInjected e) {
            LOG.infov(
                    "[{0}] feedback captured for round {1}: {2} step(s)",
                    phase,
                    e.feedback().iteration(),
                    e.feedback().actionableSteps().size());
        } else if (event instanceof OrchestrationEvent.ContinuationRequired e) {
            LOG.infov(
                    "[{0}] round {1}/{2} failed, continuing ({3})",
                    phase,
                    e.iteration(),
                    e.maxIterations(),
                    e.autonomous() ? "autonomous" : "awaiting input");
        } else if (event instanceof OrchestrationEvent.DecisionMade e) {
            LOG.infov(
                    "[{0}] decision {1} confidence={2}",
                    phase,
                    e.decision().decision(),
                    format(e.decision().confidence()));
        } else if (event instanceof OrchestrationEvent.PhaseEscalated e) {
            LOG.warnv("[{0}] escalated: {1}", phase, LogSanitizer.sanitize(e.reason()));
        } else if (event instanceof OrchestrationEvent.PhaseCompleted e) {
            LOG.infov(
                    "[{0}] phase finished {1} after {2} outer / {3} inner round(s)",
                    phase,
                    e.result().outcome(),
                    e.result().loop2Iterations(),
                    e.result().totalLoop3Iterations());
        }
    }

    @Override
    public void onEvent(CircuitBreakerEvent event) {
        if (event instanceof CircuitBreakerEvent.StateChanged e) {
            LOG.warnv(
                    "[{0}] {1} -> {2}, trips={3}",
                    e.circuitName(),
                    e.from(),
                    e.to(),
                    e.snapshot().totalTrips());
        } else if (event instanceof CircuitBreakerEvent.CallFailed e) {
            LOG.debugv(
                    "[{0}] call failed{1}: {2}",
                    e.circuitName(),
                    e.timedOut() ? " (timeout)" : "",
                    LogSanitizer.sanitize(e.error()));
        } else if (event instanceof CircuitBreakerEvent.CallRejected e) {
            LOG.debugv("[{0}] call rejected until {1}", e.circuitName(), e.snapshot().nextAttemptTime());
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
