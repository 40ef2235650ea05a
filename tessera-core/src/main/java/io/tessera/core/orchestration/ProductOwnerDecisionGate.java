package io.tessera.core.orchestration;

import io.tessera.core.LogConfig;
import io.tessera.core.agent.AgentExecutor;
import io.tessera.core.agent.AgentInstructions;
import io.tessera.core.agent.AgentResponse;
import io.tessera.core.agent.AgentRole;
import io.tessera.core.breaker.CircuitBreaker;
import io.tessera.core.breaker.CircuitOpenException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// {@link DecisionGate} that asks a product-owner agent.
///
/// The prompt from {@link ContinuationPrompts#productOwner} is executed through the
/// `product-owner` circuit breaker and the agent's deliverable is read by a
/// {@link DecisionParser}. Any failure along the way, including an open circuit,
/// yields an ESCALATE decision; this gate never throws.
public class ProductOwnerDecisionGate implements DecisionGate {

    private static final Logger logger =
            Logger.getLogger(ProductOwnerDecisionGate.class.getName());

    public static final String AGENT_TYPE = "product-owner";

    private final AgentExecutor executor;
    private final DecisionParser parser;
    private final CircuitBreaker breaker;
    private final LogConfig logConfig;

    /// Creates the gate.
    ///
    /// @param executor runs the product-owner agent, not null
    /// @param parser reads the agent's answer, not null
    /// @param breaker protects the agent call, not null
    /// @param logConfig logging behaviour, not null
    public ProductOwnerDecisionGate(
            AgentExecutor executor,
            DecisionParser parser,
            CircuitBreaker breaker,
            LogConfig logConfig) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
        this.logConfig = Objects.requireNonNull(logConfig, "logConfig must not be null");
    }

    @Override
    public ProductOwnerDecision decide(DecisionContext context) {
        AgentInstructions instructions =
                new AgentInstructions(
                        context.phaseId(),
                        AGENT_TYPE,
                        AgentRole.PRODUCT_OWNER,
                        ContinuationPrompts.productOwner(context),
                        context.iteration(),
                        0);
        AgentResponse response;
        try {
            response = breaker.execute(() -> executor.execute(instructions));
        } catch (CircuitOpenException e) {
            return ProductOwnerDecision.escalate("Product Owner unavailable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProductOwnerDecision.escalate("Product Owner decision interrupted");
        } catch (Exception e) {
            logger.log(Level.WARNING, "Product Owner agent failed for phase " + context.phaseId(), e);
            return ProductOwnerDecision.escalate("Product Owner agent failed: " + e.getMessage());
        }

        if (!(response instanceof AgentResponse.WorkResult work)) {
            return ProductOwnerDecision.parsingFailed(
                    "expected a work result, got " + response.getClass().getSimpleName());
        }
        ProductOwnerDecision decision = parser.parse(work.deliverable());
        if (logConfig.isEnabled(Level.INFO)) {
            logger.info(
                    "Product Owner decision for phase "
                            + context.phaseId()
                            + ": "
                            + decision.decision()
                            + " (confidence "
                            + decision.confidence()
                            + ")");
        }
        return decision;
    }
}
