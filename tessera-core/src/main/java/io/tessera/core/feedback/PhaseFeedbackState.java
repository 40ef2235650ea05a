package io.tessera.core.feedback;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Per-phase dedup registry and feedback history.
///
/// Both structures are bounded; the oldest entries go first.
///
/// @implNote Not thread-safe. {@link FeedbackInjector} synchronizes on the instance.
final class PhaseFeedbackState {

    private final Set<String> seenIssues;
    private final Deque<ConsensusFeedback> history = new ArrayDeque<>();
    private final int maxHistory;

    PhaseFeedbackState(int maxEntries, int maxHistory) {
        this.maxHistory = maxHistory;
        this.seenIssues =
                Collections.newSetFromMap(
                        new LinkedHashMap<>() {
                            @Override
                            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                                return size() > maxEntries;
                            }
                        });
    }

    /// Returns `true` if the key was already registered.
    boolean isSeen(String issueKey) {
        return seenIssues.contains(issueKey);
    }

    void markSeen(String issueKey) {
        seenIssues.add(issueKey);
    }

    int registrySize() {
        return seenIssues.size();
    }

    void record(ConsensusFeedback feedback) {
        history.addLast(feedback);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
    }

    List<ConsensusFeedback> history() {
        return List.copyOf(history);
    }

    List<IterationHistory> previousIterations() {
        return history.stream()
                .map(
                        fb ->
                                new IterationHistory(
                                        fb.iteration(),
                                        fb.score(),
                                        fb.allIssues(),
                                        fb.score() >= fb.requiredScore()))
                .toList();
    }
}
