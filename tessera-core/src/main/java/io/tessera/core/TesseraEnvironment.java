package io.tessera.core;

import io.tessera.core.breaker.CircuitBreakerRegistry;
import io.tessera.core.feedback.FeedbackInjector;
import io.tessera.core.orchestration.IterationOrchestrator;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/// Container of the wired coordination components.
///
/// Created by {@link TesseraFactory}. Owns the executor that runs protected agent
/// calls and must be closed when no longer needed.
///
/// @see TesseraFactory
public final class TesseraEnvironment implements AutoCloseable {

    private final TesseraConfig config;
    private final IterationOrchestrator orchestrator;
    private final CircuitBreakerRegistry circuitBreakers;
    private final FeedbackInjector feedbackInjector;
    private final ExecutorService executorService;

    public TesseraEnvironment(
            TesseraConfig config,
            IterationOrchestrator orchestrator,
            CircuitBreakerRegistry circuitBreakers,
            FeedbackInjector feedbackInjector,
            ExecutorService executorService) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.circuitBreakers =
                Objects.requireNonNull(circuitBreakers, "circuitBreakers must not be null");
        this.feedbackInjector =
                Objects.requireNonNull(feedbackInjector, "feedbackInjector must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
    }

    public TesseraConfig getConfig() {
        return config;
    }

    public IterationOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    public FeedbackInjector getFeedbackInjector() {
        return feedbackInjector;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Shuts the orchestrator down and releases the executor.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not block. In-flight
    /// agent calls finish on their own.
    @Override
    public void close() {
        orchestrator.shutdown();
        executorService.shutdown();
    }
}
