package io.tessera.core.feedback;

/// Estimated effort of an actionable step. Declaration order is ascending effort.
public enum Effort {
    LOW,
    MEDIUM,
    HIGH
}
