package io.tessera.core.feedback;

import java.util.Locale;

/// Issue severity, doubling as the priority of the step derived from it.
///
/// Declaration order is priority order: `CRITICAL` sorts first.
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
