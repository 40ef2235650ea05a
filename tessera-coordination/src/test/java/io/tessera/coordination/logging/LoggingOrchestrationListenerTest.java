package io.tessera.coordination.logging;

import static org.assertj.core.api.Assertions.assertThat;

import io.tessera.coordination.ManualClock;
import io.tessera.core.LogConfig;
import io.tessera.core.agent.AgentExecutor;
import io.tessera.core.agent.AgentResponse;
import io.tessera.core.agent.AgentRole;
import io.tessera.core.breaker.CircuitBreakerConfig;
import io.tessera.core.breaker.CircuitBreakerRegistry;
import io.tessera.core.consensus.Vote;
import io.tessera.core.orchestration.IterationOrchestrator;
import io.tessera.core.orchestration.OrchestratorConfig;
import io.tessera.core.orchestration.PhaseResult;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/// Runs a phase with the listener attached and inspects what reaches the log.
///
/// JBoss Logging delegates to `java.util.logging` when no other backend is on the
/// test classpath, so a plain JUL handler sees the records. Parameters are applied
/// with the JUL formatter.
@DisplayName("LoggingOrchestrationListener")
class LoggingOrchestrationListenerTest {

    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Handler capture =
            new Handler() {
                @Override
                public void publish(LogRecord record) {
                    records.add(record);
                }

                @Override
                public void flush() {}

                @Override
                public void close() {}
            };

    private final SimpleFormatter formatter = new SimpleFormatter();

    private Logger julLogger;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        julLogger = Logger.getLogger(LoggingOrchestrationListener.class.getName());
        julLogger.addHandler(capture);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        julLogger.removeHandler(capture);
        executor.shutdownNow();
    }

    private List<String> messages(Level level) {
        return records.stream()
                .filter(r -> r.getLevel().intValue() == level.intValue())
                .map(formatter::formatMessage)
                .toList();
    }

    @Test
    @DisplayName("logs round progress, breaker trips and the escalation")
    void shouldLogPhaseLifecycle() {
        ManualClock clock = ManualClock.at("2026-06-01T10:00:00Z");
        LoggingOrchestrationListener listener = new LoggingOrchestrationListener();
        CircuitBreakerRegistry breakers =
                new CircuitBreakerRegistry(
                        CircuitBreakerConfig.defaults(), executor, clock, LogConfig.quiet());
        breakers.addListener(listener);
        AtomicInteger primaryCalls = new AtomicInteger();
        AgentExecutor agents =
                in -> {
                    if (in.role() == AgentRole.PRIMARY) {
                        if (primaryCalls.incrementAndGet() <= 3) {
                            throw new IOException("backend\nunavailable");
                        }
                        return AgentResponse.WorkResult.of("coder-1", "coder", "patch", 0.9);
                    }
                    return AgentResponse.ValidationResult.of(
                            in.agentType() + "-1", in.agentType(), Vote.FAIL, 0.4, "Missing tests");
                };
        IterationOrchestrator orchestrator =
                IterationOrchestrator.builder()
                        .config(
                                OrchestratorConfig.builder()
                                        .maxLoop2Iterations(1)
                                        .maxLoop3Iterations(6)
                                        .validatorAgentTypes(List.of("reviewer"))
                                        .build())
                        .agents(agents)
                        .breakers(breakers)
                        .clock(clock)
                        .sleeper(clock.sleeper())
                        .logConfig(LogConfig.quiet())
                        .build();
        orchestrator.addListener(listener);

        PhaseResult result = orchestrator.executePhase("auth", "Add login");

        assertThat(result.escalated()).isTrue();
        assertThat(messages(Level.INFO))
                .contains("[auth] phase started")
                .anyMatch(m -> m.startsWith("[auth] consensus gate FAIL 0.40"));
        assertThat(messages(Level.WARNING))
                .anyMatch(m -> m.startsWith("[primary-execution]") && m.contains("-> OPEN"))
                .anyMatch(m -> m.startsWith("[auth] escalated: Maximum Loop 2 iterations (1)"));
        assertThat(records).noneMatch(r -> formatter.formatMessage(r).contains("\n"));
    }
}
