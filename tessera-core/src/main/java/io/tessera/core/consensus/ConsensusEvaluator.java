package io.tessera.core.consensus;

import io.tessera.core.LogConfig;
import io.tessera.core.audit.AuditRecorder;
import io.tessera.core.audit.RiskLevel;
import io.tessera.core.audit.SafeAuditRecorder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Turns a round of validator votes into a pass/fail consensus score.
///
/// ### Simple Mode
/// Score is the arithmetic mean of the vote confidences; the round passes when
/// the score reaches the threshold.
///
/// ### Byzantine Mode
/// Validators flagged in earlier rounds are dropped first. The remaining votes
/// go through three quorum checks, where quorum defaults to `ceil(2n/3)`:
/// - **prepare**: votes with confidence above `0`
/// - **commit**: votes with confidence of at least `0.5`
/// - **reply**: votes cast as PASS
///
/// The score sums the confidences of PASS votes and divides by the number of
/// *all* votes, so a FAIL vote both contributes nothing and dilutes the mean.
/// The round passes when the score reaches the threshold and all three phases
/// succeeded. Malicious-validator detection runs on the same votes; flagged
/// validators are audited, reported to the listener and distrusted in later
/// rounds.
///
/// Any exception in the Byzantine path degrades to a simple-mode score marked
/// as a fallback.
///
/// @implNote Thread-safe. The only mutable state is the set of distrusted
/// validators, held in a concurrent set.
///
/// @see ConsensusConfig
/// @see MaliciousAgentDetector
public class ConsensusEvaluator {

    private static final Logger logger = Logger.getLogger(ConsensusEvaluator.class.getName());

    static final String AUDIT_CATEGORY_MALICIOUS = "validator:malicious";
    private static final double COMMIT_CONFIDENCE = 0.5;

    private final ConsensusConfig config;
    private final MaliciousAgentDetector detector;
    private final AuditRecorder auditRecorder;
    private final ConsensusListener listener;
    private final LogConfig logConfig;
    private final Set<String> distrusted = ConcurrentHashMap.newKeySet();

    public ConsensusEvaluator(ConsensusConfig config) {
        this(config, AuditRecorder.NOOP, ConsensusListener.NOOP, LogConfig.defaults());
    }

    /// Creates an evaluator.
    ///
    /// @param config scoring configuration, not null
    /// @param auditRecorder sink for malicious-validator records, not null
    /// @param listener observer for detections and fallbacks, not null
    /// @param logConfig logging behaviour, not null
    public ConsensusEvaluator(
            ConsensusConfig config,
            AuditRecorder auditRecorder,
            ConsensusListener listener,
            LogConfig logConfig) {
        this(config, new MaliciousAgentDetector(config), auditRecorder, listener, logConfig);
    }

    ConsensusEvaluator(
            ConsensusConfig config,
            MaliciousAgentDetector detector,
            AuditRecorder auditRecorder,
            ConsensusListener listener,
            LogConfig logConfig) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.auditRecorder = SafeAuditRecorder.wrap(auditRecorder);
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.logConfig = Objects.requireNonNull(logConfig, "logConfig must not be null");
    }

    public ConsensusConfig getConfig() {
        return config;
    }

    /// Evaluates one round of votes in the configured mode.
    ///
    /// @param votes the round's votes, not null
    /// @return consensus result, never null
    public ConsensusResult evaluate(List<ValidatorVote> votes) {
        Objects.requireNonNull(votes, "votes must not be null");
        if (logConfig.isEnabled(Level.INFO)) {
            logger.info(
                    "Evaluating consensus: mode=" + config.mode() + ", votes=" + votes.size());
        }

        if (config.mode() == ConsensusMode.SIMPLE) {
            return evaluateSimple(votes, false);
        }
        try {
            return evaluateByzantine(votes);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Byzantine consensus failed, falling back to simple mode", e);
            notifyFallback(e);
            return evaluateSimple(votes, true);
        }
    }

    /// Returns the validators distrusted after earlier detections.
    ///
    /// @return immutable copy, never null
    public Set<String> getDistrustedAgents() {
        return Set.copyOf(distrusted);
    }

    /// Restores trust in every validator.
    public void clearDistrustedAgents() {
        distrusted.clear();
    }

    // --- Simple mode ---

    ConsensusResult evaluateSimple(List<ValidatorVote> votes, boolean fallback) {
        double score =
                votes.stream().mapToDouble(ValidatorVote::confidence).average().orElse(0.0);
        boolean passed = !votes.isEmpty() && score >= config.threshold();
        if (logConfig.isEnabled(Level.INFO)) {
            logger.info(
                    String.format(
                            "Simple consensus: score=%.3f threshold=%.2f passed=%s",
                            score, config.threshold(), passed));
        }
        return new ConsensusResult(
                score,
                config.threshold(),
                passed,
                votes,
                ConsensusMode.SIMPLE,
                fallback ? Integer.valueOf(0) : null,
                List.of(),
                fallback ? PbftPhases.NONE : null,
                fallback,
                breakdown(votes));
    }

    // --- Byzantine mode ---

    ConsensusResult evaluateByzantine(List<ValidatorVote> votes) {
        List<ValidatorVote> trusted =
                votes.stream().filter(v -> !distrusted.contains(v.agentId())).toList();
        if (trusted.size() < votes.size() && logConfig.isEnabled(Level.INFO)) {
            logger.info(
                    "Excluded "
                            + (votes.size() - trusted.size())
                            + " vote(s) from previously flagged validators");
        }

        int n = trusted.size();
        int quorum = config.quorumFor(n);

        long prepared = trusted.stream().filter(v -> v.confidence() > 0.0).count();
        long committed = trusted.stream().filter(v -> v.confidence() >= COMMIT_CONFIDENCE).count();
        long replied = trusted.stream().filter(ValidatorVote::isPass).count();
        PbftPhases phases =
                new PbftPhases(prepared >= quorum, committed >= quorum, replied >= quorum);

        double passConfidence =
                trusted.stream()
                        .filter(ValidatorVote::isPass)
                        .mapToDouble(ValidatorVote::confidence)
                        .sum();
        double score = n == 0 ? 0.0 : passConfidence / n;

        List<MaliciousAgentReport> malicious = detectMalicious(trusted);

        boolean passed = n > 0 && score >= config.threshold() && phases.allSucceeded();
        if (logConfig.isEnabled(Level.INFO)) {
            logger.info(
                    String.format(
                            "Byzantine consensus: score=%.3f threshold=%.2f quorum=%d/%d"
                                    + " phases=%s malicious=%d passed=%s",
                            score,
                            config.threshold(),
                            quorum,
                            n,
                            phases,
                            malicious.size(),
                            passed));
        }
        return new ConsensusResult(
                score,
                config.threshold(),
                passed,
                trusted,
                ConsensusMode.BYZANTINE,
                quorum,
                malicious,
                phases,
                false,
                breakdown(trusted));
    }

    private List<MaliciousAgentReport> detectMalicious(List<ValidatorVote> votes) {
        List<MaliciousAgentReport> reports;
        try {
            reports = detector.detect(votes);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Malicious-agent detection failed", e);
            return List.of();
        }
        for (MaliciousAgentReport report : reports) {
            distrusted.add(report.agentId());
            logger.warning(
                    "Malicious validator detected: " + report.agentId() + " (" + report.summary() + ")");
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("agentId", report.agentId());
            payload.put("agentType", report.agentType());
            payload.put("reasons", report.reasons());
            auditRecorder.recordEvent(AUDIT_CATEGORY_MALICIOUS, payload, RiskLevel.HIGH);
            try {
                listener.onMaliciousAgentDetected(report);
            } catch (Exception e) {
                logger.log(Level.WARNING, "Consensus listener failed", e);
            }
        }
        return reports;
    }

    private void notifyFallback(Exception cause) {
        try {
            listener.onFallbackToSimple(cause);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Consensus listener failed", e);
        }
    }

    private ConsensusResult.VotingBreakdown breakdown(List<ValidatorVote> votes) {
        int approve = 0;
        int reject = 0;
        for (ValidatorVote vote : votes) {
            if (vote.confidence() >= config.approvalConfidence()) {
                approve++;
            } else {
                reject++;
            }
        }
        return new ConsensusResult.VotingBreakdown(approve, reject);
    }
}
