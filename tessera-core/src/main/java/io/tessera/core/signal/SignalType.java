package io.tessera.core.signal;

import java.util.Locale;

/// Kind of coordination signal exchanged between coordinators.
public enum SignalType {
    /// Work for the current iteration is complete and ready for the receiver.
    COMPLETE,
    /// The receiver should re-run its step for the given iteration.
    RETRY,
    /// The receiver should stop and release its resources.
    ABORT;

    /// Returns the lowercase name used in keys and on the wire.
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a wire name, case-insensitively.
    ///
    /// @param value wire name, not null
    /// @return the matching type
    /// @throws IllegalArgumentException if no type matches
    public static SignalType fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
