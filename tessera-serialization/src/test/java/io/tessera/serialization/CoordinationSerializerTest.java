package io.tessera.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tessera.core.feedback.ActionableStep;
import io.tessera.core.feedback.ConsensusFeedback;
import io.tessera.core.feedback.Effort;
import io.tessera.core.feedback.FeedbackIssue;
import io.tessera.core.feedback.IssueLocation;
import io.tessera.core.feedback.IssueType;
import io.tessera.core.feedback.Severity;
import io.tessera.core.feedback.ValidatorFeedback;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

/// Serialization tests for feedback records persisted alongside coordinator state.
///
/// @see TesseraJacksonModule for the enum wire names
class CoordinationSerializerTest {

    private static ConsensusFeedback feedback() {
        FeedbackIssue issue =
                new FeedbackIssue(
                        IssueType.SECURITY,
                        Severity.CRITICAL,
                        "Password compared with ==",
                        new IssueLocation("auth/Login.java", 42, "verify"),
                        "Use MessageDigest.isEqual");
        return new ConsensusFeedback(
                "auth",
                2,
                0.7,
                0.9,
                List.of(
                        new ValidatorFeedback(
                                "sec-1", "security-specialist", List.of(issue), List.of(),
                                List.of("constant-time comparison"), 0.4)),
                List.of("constant-time comparison"),
                List.of(
                        new ActionableStep(
                                Severity.CRITICAL,
                                "security",
                                "Use MessageDigest.isEqual",
                                "security-specialist",
                                Effort.LOW)),
                List.of(),
                Instant.parse("2026-04-02T08:15:30Z"));
    }

    @Test
    void toJson_writesLowercaseEnums() {
        String json = CoordinationSerializer.toJson(feedback());

        assertThat(json)
                .contains("\"severity\":\"critical\"")
                .contains("\"type\":\"security\"")
                .contains("\"estimatedEffort\":\"low\"")
                .contains("\"timestamp\":\"2026-04-02T08:15:30Z\"");
    }

    @Test
    void roundTrip_consensusFeedback() {
        ConsensusFeedback restored =
                CoordinationSerializer.fromJson(
                        CoordinationSerializer.toJson(feedback()), ConsensusFeedback.class);

        assertThat(restored).isEqualTo(feedback());
        assertThat(restored.allIssues())
                .singleElement()
                .satisfies(i -> assertThat(i.location().line()).isEqualTo(42));
    }

    @Test
    void fromJson_ignoresUnknownProperties() {
        FeedbackIssue issue =
                CoordinationSerializer.fromJson(
                        "{\"type\":\"testing\",\"severity\":\"HIGH\",\"message\":\"No tests\","
                                + "\"addedInFutureVersion\":true}",
                        FeedbackIssue.class);

        assertThat(issue.type()).isEqualTo(IssueType.TESTING);
        assertThat(issue.severity()).isEqualTo(Severity.HIGH);
        assertThat(issue.location()).isNull();
    }

    @Test
    void fromJson_rejectsInvalidRecord() {
        assertThatThrownBy(
                        () ->
                                CoordinationSerializer.fromJson(
                                        "{\"type\":\"testing\"}", FeedbackIssue.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to deserialize FeedbackIssue");
    }
}
