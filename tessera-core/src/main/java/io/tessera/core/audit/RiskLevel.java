package io.tessera.core.audit;

/// Severity attached to an audit record.
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
