package io.tessera.core.feedback;

import java.util.Objects;

/// One criticism raised by a validator.
///
/// @param type issue category, not null
/// @param severity issue severity, not null
/// @param message description, not null
/// @param location where the issue is, may be null
/// @param suggestedFix validator's proposed fix, may be null
public record FeedbackIssue(
        IssueType type,
        Severity severity,
        String message,
        IssueLocation location,
        String suggestedFix) {

    public FeedbackIssue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static FeedbackIssue of(IssueType type, Severity severity, String message) {
        return new FeedbackIssue(type, severity, message, null, null);
    }

    /// Returns the deduplication key `type:severity:message:location`.
    ///
    /// The location part is `file:line:function` with empty components for absent
    /// values, or `no-location`.
    public String dedupKey() {
        String locationKey =
                location == null
                        ? "no-location"
                        : nullToEmpty(location.file())
                                + ":"
                                + (location.line() != null ? location.line() : "")
                                + ":"
                                + nullToEmpty(location.function());
        return type.wireName() + ":" + severity.wireName() + ":" + message + ":" + locationKey;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
