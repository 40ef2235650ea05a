package io.tessera.core.audit;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Decorator that logs and suppresses failures of the wrapped recorder.
public final class SafeAuditRecorder implements AuditRecorder {

    private static final Logger logger = Logger.getLogger(SafeAuditRecorder.class.getName());

    private final AuditRecorder delegate;

    private SafeAuditRecorder(AuditRecorder delegate) {
        this.delegate = delegate;
    }

    /// Wraps a recorder unless it is already wrapped.
    ///
    /// @param recorder recorder to protect, null yields {@link AuditRecorder#NOOP}
    /// @return safe recorder, never null
    public static AuditRecorder wrap(AuditRecorder recorder) {
        if (recorder == null) {
            return NOOP;
        }
        if (recorder instanceof SafeAuditRecorder) {
            return recorder;
        }
        return new SafeAuditRecorder(recorder);
    }

    @Override
    public void recordEvent(String category, Map<String, Object> payload, RiskLevel riskLevel) {
        Objects.requireNonNull(category, "category must not be null");
        try {
            delegate.recordEvent(category, payload, riskLevel);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Audit recording failed for category " + category, e);
        }
    }
}
