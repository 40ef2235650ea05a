package io.tessera.core.feedback;

/// Where an issue was found. Every component is optional.
///
/// @param file source file, may be null
/// @param line 1-based line number, may be null
/// @param function enclosing function or method, may be null
public record IssueLocation(String file, Integer line, String function) {

    /// Renders `file:line`, omitting absent parts.
    public String describe() {
        String base = file != null ? file : "N/A";
        return line != null ? base + ":" + line : base;
    }
}
