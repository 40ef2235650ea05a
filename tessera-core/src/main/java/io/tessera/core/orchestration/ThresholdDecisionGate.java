package io.tessera.core.orchestration;

import io.tessera.core.agent.AgentResponse;
import io.tessera.core.feedback.FeedbackIssue;
import io.tessera.core.feedback.Severity;
import io.tessera.core.feedback.ValidatorFeedback;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Rule-based {@link DecisionGate} that needs no product-owner agent.
///
/// - ESCALATE when a validator or primary agent still reports a blocker, or a
///   validator reports a critical issue
/// - DEFER when only non-critical issues or recommendations remain; they become
///   backlog items
/// - PROCEED otherwise
public class ThresholdDecisionGate implements DecisionGate {

    @Override
    public ProductOwnerDecision decide(DecisionContext context) {
        Set<String> blockers = new LinkedHashSet<>(context.consensus().blockers());
        for (AgentResponse.WorkResult deliverable : context.deliverables()) {
            blockers.addAll(deliverable.blockers());
        }
        List<String> critical = new ArrayList<>();
        Set<String> backlog = new LinkedHashSet<>();
        for (ValidatorFeedback vf : context.validatorFeedback()) {
            for (FeedbackIssue issue : vf.issues()) {
                if (issue.severity() == Severity.CRITICAL) {
                    critical.add(issue.message());
                } else {
                    backlog.add(issue.message());
                }
            }
            backlog.addAll(vf.recommendations());
        }
        double score = context.consensus().score();

        if (!blockers.isEmpty() || !critical.isEmpty()) {
            List<String> all = new ArrayList<>(blockers);
            all.addAll(critical);
            return new ProductOwnerDecision(
                    Decision.ESCALATE,
                    score,
                    all.size() + " blocking issue(s) remain after consensus",
                    List.of(),
                    all,
                    List.of());
        }
        if (!backlog.isEmpty()) {
            return new ProductOwnerDecision(
                    Decision.DEFER,
                    score,
                    "Consensus reached; " + backlog.size() + " non-critical item(s) deferred",
                    List.copyOf(backlog),
                    List.of(),
                    List.of());
        }
        return new ProductOwnerDecision(
                Decision.PROCEED,
                score,
                "Consensus reached with no outstanding issues",
                List.of(),
                List.of(),
                List.of());
    }
}
