package io.tessera.core.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SafeAuditRecorder")
class SafeAuditRecorderTest {

    @Test
    @DisplayName("forwards events to the delegate")
    void shouldForward() {
        AuditRecorder delegate = mock(AuditRecorder.class);

        SafeAuditRecorder.wrap(delegate)
                .recordEvent("phase:started", Map.of("phaseId", "auth"), RiskLevel.LOW);

        verify(delegate).recordEvent(eq("phase:started"), anyMap(), eq(RiskLevel.LOW));
    }

    @Test
    @DisplayName("suppresses delegate failures")
    void shouldSuppressFailures() {
        AuditRecorder delegate = mock(AuditRecorder.class);
        doThrow(new IllegalStateException("audit store offline"))
                .when(delegate)
                .recordEvent(any(), any(), any());

        assertThatCode(
                        () ->
                                SafeAuditRecorder.wrap(delegate)
                                        .recordEvent("phase:escalated", Map.of(), RiskLevel.MEDIUM))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("does not double-wrap and maps null to NOOP")
    void shouldWrapOnce() {
        AuditRecorder wrapped = SafeAuditRecorder.wrap(mock(AuditRecorder.class));

        assertThat(SafeAuditRecorder.wrap(wrapped)).isSameAs(wrapped);
        assertThat(SafeAuditRecorder.wrap(null)).isSameAs(AuditRecorder.NOOP);
    }
}
