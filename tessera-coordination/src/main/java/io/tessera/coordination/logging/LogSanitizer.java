package io.tessera.coordination.logging;

/// Strips control characters from strings to prevent log injection.
///
/// Coordinator ids and signal payloads come from other processes through the
/// shared store. A value containing `\r` or `\n` could forge log entries, so apply
/// this to any such value before passing it to a logger:
/// ```
/// LOG.infov("Signal from {0}", LogSanitizer.sanitize(signal.source()));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// Removes carriage returns and newlines, and replaces other control characters
    /// with a space.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\r' || c == '\n') {
                continue;
            }
            sb.append(Character.isISOControl(c) ? ' ' : c);
        }
        return sb.toString();
    }
}
