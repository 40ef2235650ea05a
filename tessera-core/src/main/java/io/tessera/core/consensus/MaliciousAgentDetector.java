package io.tessera.core.consensus;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Flags validators whose votes look adversarial.
///
/// A vote is flagged when at least two of these criteria hold:
/// 1. its confidence lies more than `outlierStdDevs` population standard deviations
///    from the round's mean confidence
/// 2. its signature does not match a recomputation, see {@link VoteSigner}
/// 3. its reasoning is shorter than `minReasoningLength` characters
///
/// Detection never throws. A vote whose inspection fails is treated as benign.
public class MaliciousAgentDetector {

    private static final Logger logger = Logger.getLogger(MaliciousAgentDetector.class.getName());

    static final int CRITERIA_REQUIRED = 2;

    private final double outlierStdDevs;
    private final int minReasoningLength;

    public MaliciousAgentDetector(double outlierStdDevs, int minReasoningLength) {
        this.outlierStdDevs = outlierStdDevs;
        this.minReasoningLength = minReasoningLength;
    }

    public MaliciousAgentDetector(ConsensusConfig config) {
        this(config.outlierStdDevs(), config.minReasoningLength());
    }

    /// Inspects a round of votes.
    ///
    /// @param votes the round's votes, not null
    /// @return reports for flagged validators in vote order, never null
    public List<MaliciousAgentReport> detect(List<ValidatorVote> votes) {
        List<MaliciousAgentReport> flagged = new ArrayList<>();
        if (votes.isEmpty()) {
            return flagged;
        }

        double mean = votes.stream().mapToDouble(ValidatorVote::confidence).average().orElse(0.0);
        double variance =
                votes.stream()
                        .mapToDouble(v -> Math.pow(v.confidence() - mean, 2))
                        .average()
                        .orElse(0.0);
        double stdDev = Math.sqrt(variance);

        for (ValidatorVote vote : votes) {
            try {
                List<String> reasons = new ArrayList<>();
                if (stdDev > 0 && Math.abs(vote.confidence() - mean) > outlierStdDevs * stdDev) {
                    reasons.add(
                            String.format(
                                    "confidence %.2f is more than %.1f standard deviations from"
                                            + " mean %.2f",
                                    vote.confidence(), outlierStdDevs, mean));
                }
                if (!VoteSigner.verify(vote)) {
                    reasons.add("signature verification failed");
                }
                if (vote.reasoning().trim().length() < minReasoningLength) {
                    reasons.add(
                            "reasoning shorter than " + minReasoningLength + " characters");
                }
                if (reasons.size() >= CRITERIA_REQUIRED) {
                    flagged.add(new MaliciousAgentReport(vote.agentId(), vote.agentType(), reasons));
                }
            } catch (RuntimeException e) {
                logger.log(
                        Level.FINE,
                        "Malicious-agent check failed for " + vote.agentId() + ", treating as benign",
                        e);
            }
        }
        return flagged;
    }
}
