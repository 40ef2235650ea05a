package io.tessera.core.feedback;

import java.util.Locale;

/// Category of a validator-reported issue.
public enum IssueType {
    QUALITY("reviewer"),
    SECURITY("security-specialist"),
    PERFORMANCE("perf-analyzer"),
    ARCHITECTURE("system-architect"),
    TESTING("tester"),
    DOCUMENTATION("coder");

    private final String responsibleAgent;

    IssueType(String responsibleAgent) {
        this.responsibleAgent = responsibleAgent;
    }

    /// Returns the agent type expected to fix issues of this category.
    public String responsibleAgent() {
        return responsibleAgent;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
