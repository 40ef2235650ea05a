package io.tessera.core.audit;

import java.util.Map;

/// Fire-and-forget sink for security-relevant events.
///
/// Used for malicious-validator detections, escalations and signature
/// mismatches. Callers never depend on the outcome: wrap implementations in
/// {@link SafeAuditRecorder} so a failing sink cannot abort the operation being
/// audited.
@FunctionalInterface
public interface AuditRecorder {

    /// Recorder that discards everything.
    AuditRecorder NOOP = (category, payload, riskLevel) -> {};

    /// Records an event.
    ///
    /// @param category event category, e.g. `validator:malicious`, not null
    /// @param payload structured event details, not null
    /// @param riskLevel severity, not null
    void recordEvent(String category, Map<String, Object> payload, RiskLevel riskLevel);
}
