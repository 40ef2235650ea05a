package io.tessera.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.tessera.core.consensus.ConsensusMode;
import io.tessera.core.consensus.Vote;
import io.tessera.core.feedback.Effort;
import io.tessera.core.feedback.IssueType;
import io.tessera.core.feedback.Severity;
import io.tessera.core.orchestration.Decision;
import io.tessera.core.signal.SignalType;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the Tessera wire conventions in one place.
///
/// Every coordination enum is written as its lowercase name and read
/// case-insensitively:
/// - {@link SignalType}, {@link Vote}, {@link ConsensusMode}
/// - {@link Severity}, {@link IssueType}, {@link Effort}
/// - {@link Decision}
///
/// Records ({@code Signal}, {@code SignalAck}, feedback types) need no registration;
/// Jackson binds them through their canonical constructors, so the compact
/// constructors validate every decoded value.
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see CoordinationSerializer for the convenience factory API
public class TesseraJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2817336401958125873L;

    public TesseraJacksonModule() {
        super("TesseraJacksonModule");
        wire(SignalType.class);
        wire(Vote.class);
        wire(ConsensusMode.class);
        wire(Severity.class);
        wire(IssueType.class);
        wire(Effort.class);
        wire(Decision.class);
    }

    private <E extends Enum<E>> void wire(Class<E> type) {
        addSerializer(type, new WireEnumSerializer<>(type));
        addDeserializer(type, new WireEnumDeserializer<>(type));
    }
}
