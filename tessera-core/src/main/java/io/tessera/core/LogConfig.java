package io.tessera.core;

import java.util.Objects;
import java.util.logging.Level;

/// Logging behaviour handed to each component at construction.
///
/// Components never read verbosity from environment variables. Instead, the
/// embedding application builds one `LogConfig` and passes it down through
/// {@link TesseraFactory}. A component checks {@link #isEnabled(Level)} before
/// emitting a record, which keeps a verbose JUL or JBoss handler from being
/// flooded by a component the caller wants quiet.
///
/// @param level minimum level a component emits, not null
/// @param logPayloads whether free-text payloads (agent output, signal bodies)
///        may appear in log messages
public record LogConfig(Level level, boolean logPayloads) {

    private static final int MAX_PAYLOAD_CHARS = 200;

    public LogConfig {
        Objects.requireNonNull(level, "level must not be null");
    }

    /// Default configuration: `INFO` and above, payload text redacted.
    public static LogConfig defaults() {
        return new LogConfig(Level.INFO, false);
    }

    /// Configuration for noisy test or debug sessions.
    public static LogConfig verbose() {
        return new LogConfig(Level.FINE, true);
    }

    /// Configuration that only lets warnings and errors through.
    public static LogConfig quiet() {
        return new LogConfig(Level.WARNING, false);
    }

    /// Checks whether a record at the given level should be emitted.
    ///
    /// @param candidate level of the record about to be logged, not null
    /// @return `true` if `candidate` is at or above the configured level
    public boolean isEnabled(Level candidate) {
        return candidate.intValue() >= level.intValue();
    }

    /// Renders a free-text payload for inclusion in a log line.
    ///
    /// Returns `"<redacted>"` unless payload logging is enabled, in which case
    /// the text is stripped of line breaks and truncated.
    ///
    /// @param payload text to render, may be null
    /// @return loggable representation, never null
    public String payload(String payload) {
        if (!logPayloads) {
            return "<redacted>";
        }
        if (payload == null) {
            return "null";
        }
        String flat = payload.replace("\r", "").replace("\n", " ");
        return flat.length() > MAX_PAYLOAD_CHARS
                ? flat.substring(0, MAX_PAYLOAD_CHARS) + "..."
                : flat;
    }
}
