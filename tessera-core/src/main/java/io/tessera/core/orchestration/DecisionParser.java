package io.tessera.core.orchestration;

/// Reads a {@link ProductOwnerDecision} from free-form agent output.
///
/// Implementations never throw on malformed input; they return
/// {@link ProductOwnerDecision#parsingFailed(String)} instead.
@FunctionalInterface
public interface DecisionParser {

    /// @param rawOutput agent output, may be null
    /// @return the decision, never null
    ProductOwnerDecision parse(String rawOutput);
}
