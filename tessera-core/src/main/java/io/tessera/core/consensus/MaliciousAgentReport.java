package io.tessera.core.consensus;

import java.util.List;
import java.util.Objects;

/// A validator flagged as malicious together with the criteria it violated.
///
/// @param agentId flagged validator, not null
/// @param agentType validator role, not null
/// @param reasons human-readable violated criteria, at least two, not null
public record MaliciousAgentReport(String agentId, String agentType, List<String> reasons) {

    public MaliciousAgentReport {
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(agentType, "agentType must not be null");
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    /// Joins the reasons into one sentence for logs and audit records.
    public String summary() {
        return String.join("; ", reasons);
    }
}
