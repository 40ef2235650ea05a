package io.tessera.coordination.signal;

import io.tessera.coordination.event.CoordinationEvent;
import io.tessera.coordination.event.CoordinationListener;
import io.tessera.coordination.event.CoordinationListeners;
import io.tessera.coordination.logging.LogSanitizer;
import io.tessera.core.LogConfig;
import io.tessera.core.signal.AckSigner;
import io.tessera.core.signal.SafeIds;
import io.tessera.core.signal.Signal;
import io.tessera.core.signal.SignalAck;
import io.tessera.core.signal.SignalCodec;
import io.tessera.core.signal.SignalIds;
import io.tessera.core.signal.SignalType;
import io.tessera.core.signal.SignatureVerificationException;
import io.tessera.core.store.SharedStore;
import io.tessera.core.util.Sleeper;
import io.tessera.serialization.CoordinationSerializer;
import io.tessera.serialization.JacksonSignalCodec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import org.jboss.logging.Logger;

/// Signal delivery with signed, idempotent acknowledgments over a {@link SharedStore}.
///
/// ### Delivery flow
/// ```
/// sender                         store                              receiver
///   sendSignal ──────────> signal:{receiver}, idempotency:{messageId}
///                                                    <──── receiveSignal
///                          ack:{receiver}:{signalId} <──── acknowledgeSignal
///   waitForAcks <────────  (polled every pollInterval)
/// ```
///
/// ### Contracts
/// - Every identifier is checked against the safe-ID allow-list before it becomes
///   part of a key; a rejected id never reaches the store.
/// - A send whose idempotency record exists is reported as a duplicate and writes
///   nothing.
/// - `signalId` depends only on sender, receiver, type and iteration, so retried
///   sends of one logical signal share a single acknowledgment slot.
/// - Acknowledgments are HMAC-SHA256 signed; an acknowledgment whose signature does
///   not verify is never returned by {@link #waitForAcks}.
///
/// @implNote Thread-safe if the store is. The protocol keeps no mutable state of its
/// own besides the listener list.
///
/// @see AckSigner
/// @see BlockingCoordinator
public class SignalAckProtocol {

    private static final Logger LOG = Logger.getLogger(SignalAckProtocol.class);

    static final String SIGNAL_PREFIX = "signal:";
    static final String ACK_PREFIX = "ack:";
    static final String IDEMPOTENCY_PREFIX = "idempotency:";
    static final String RETRY_PREFIX = "retry:";

    private final SharedStore store;
    private final SignalCodec codec;
    private final AckSigner signer;
    private final SignalAckConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final LogConfig logConfig;
    private final CoordinationListeners listeners = new CoordinationListeners();

    /// Creates a protocol with JSON encoding, default timings and the system clock.
    ///
    /// @param store shared store, not null
    /// @param secret shared ACK signing secret, not null or blank
    /// @throws IllegalArgumentException if the secret is missing
    public SignalAckProtocol(SharedStore store, String secret) {
        this(
                store,
                new JacksonSignalCodec(),
                new AckSigner(secret),
                SignalAckConfig.defaults(),
                Clock.systemUTC(),
                Sleeper.SYSTEM,
                LogConfig.defaults());
    }

    public SignalAckProtocol(
            SharedStore store,
            SignalCodec codec,
            AckSigner signer,
            SignalAckConfig config,
            Clock clock,
            Sleeper sleeper,
            LogConfig logConfig) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.signer = Objects.requireNonNull(signer, "signer must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.logConfig = Objects.requireNonNull(logConfig, "logConfig must not be null");
    }

    public void addListener(CoordinationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CoordinationListener listener) {
        listeners.remove(listener);
    }

    public SignalAckConfig getConfig() {
        return config;
    }

    // --- Sending ---

    /// Sends a signal stamped with the current time.
    ///
    /// @see #sendSignal(String, String, SignalType, int, Map, Instant)
    public SendResult sendSignal(
            String senderId,
            String receiverId,
            SignalType type,
            int iteration,
            Map<String, Object> payload) {
        return sendSignal(senderId, receiverId, type, iteration, payload, clock.instant());
    }

    /// Sends a signal.
    ///
    /// Passing the timestamp of an earlier send re-derives the same `messageId`, so a
    /// replayed send is reported as a duplicate instead of being delivered twice.
    ///
    /// @param senderId sending coordinator, safe id
    /// @param receiverId receiving coordinator, safe id
    /// @param type signal type, not null
    /// @param iteration iteration the signal belongs to, not negative
    /// @param payload signal body, may be null
    /// @param timestamp send time, not null
    /// @return identifiers of the send, never null
    /// @throws io.tessera.core.signal.ValidationException if an id is unsafe
    public SendResult sendSignal(
            String senderId,
            String receiverId,
            SignalType type,
            int iteration,
            Map<String, Object> payload,
            Instant timestamp) {
        SafeIds.requireSafe(senderId, "senderId");
        SafeIds.requireSafe(receiverId, "receiverId");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Instant millis = Instant.ofEpochMilli(timestamp.toEpochMilli());

        String signalId = SignalIds.signalId(senderId, receiverId, type, iteration);
        String messageId = SignalIds.messageId(senderId, receiverId, type, iteration, millis);
        String idempotencyKey = IDEMPOTENCY_PREFIX + messageId;

        if (store.exists(idempotencyKey)) {
            LOG.debugv("Duplicate signal suppressed: messageId={0}", messageId);
            listeners.publish(
                    new CoordinationEvent.DuplicateSignalSuppressed(
                            messageId, signalId, clock.instant()));
            return new SendResult(messageId, signalId, true);
        }

        Signal signal =
                new Signal(
                        signalId,
                        messageId,
                        type,
                        senderId,
                        List.of(receiverId),
                        iteration,
                        payload,
                        millis);
        store.set(SIGNAL_PREFIX + receiverId, codec.encodeSignal(signal), config.signalTtl());
        store.set(idempotencyKey, signalId, config.signalTtl());

        if (logConfig.isEnabled(Level.INFO)) {
            LOG.infov(
                    "Signal sent: {0} -> {1}, type={2}, iteration={3}, signalId={4}",
                    senderId,
                    receiverId,
                    type.wireName(),
                    iteration,
                    signalId);
        }
        if (logConfig.isEnabled(Level.FINE)) {
            LOG.debugv(
                    "Signal payload: {0}",
                    LogSanitizer.sanitize(logConfig.payload(String.valueOf(signal.payload()))));
        }
        listeners.publish(new CoordinationEvent.SignalSent(signal, clock.instant()));
        return new SendResult(messageId, signalId, false);
    }

    /// Reads the latest signal addressed to a coordinator.
    ///
    /// @param receiverId receiving coordinator, safe id
    /// @return the signal, or empty if none is stored or the stored text is invalid
    public Optional<Signal> receiveSignal(String receiverId) {
        SafeIds.requireSafe(receiverId, "receiverId");
        Optional<String> raw = store.get(SIGNAL_PREFIX + receiverId);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decodeSignal(raw.get()));
        } catch (IllegalArgumentException e) {
            LOG.warnv("Discarding malformed signal for {0}: {1}", receiverId, e.getMessage());
            return Optional.empty();
        }
    }

    // --- Acknowledgment ---

    /// Acknowledges a signal on behalf of a coordinator.
    ///
    /// Must be called before the signal's payload is processed. If a valid
    /// acknowledgment for `(coordinatorId, signalId)` is already stored under that
    /// key it is returned unchanged. A stored acknowledgment that fails verification
    /// or names another coordinator or signal is overwritten.
    ///
    /// @param signal the received signal, not null
    /// @param coordinatorId acknowledging coordinator, safe id
    /// @return the stored acknowledgment, never null
    public SignalAck acknowledgeSignal(Signal signal, String coordinatorId) {
        Objects.requireNonNull(signal, "signal must not be null");
        SafeIds.requireSafe(coordinatorId, "coordinatorId");
        SafeIds.requireSafe(signal.signalId(), "signalId");
        String key = ackKey(coordinatorId, signal.signalId());

        Optional<SignalAck> existing = decodeAck(store.get(key));
        if (existing.isPresent()) {
            if (matches(existing.get(), coordinatorId, signal.signalId())) {
                LOG.debugv(
                        "Signal {0} already acknowledged by {1}", signal.signalId(), coordinatorId);
                return existing.get();
            }
            LOG.warnv(
                    "Overwriting invalid acknowledgment: coordinator={0}, signal={1}",
                    coordinatorId,
                    signal.signalId());
        }

        SignalAck ack =
                signer.createAck(
                        coordinatorId, signal.signalId(), clock.instant(), signal.iteration());
        store.set(key, codec.encodeAck(ack), config.ackTtl());
        if (logConfig.isEnabled(Level.INFO)) {
            LOG.infov(
                    "Signal acknowledged: coordinator={0}, signalId={1}, iteration={2}",
                    coordinatorId,
                    signal.signalId(),
                    signal.iteration());
        }
        listeners.publish(new CoordinationEvent.SignalAcknowledged(ack, clock.instant()));
        return ack;
    }

    /// Reads and verifies an acknowledgment.
    ///
    /// @param coordinatorId acknowledging coordinator, safe id
    /// @param signalId acknowledged signal, safe id
    /// @return the acknowledgment, or empty if none is stored
    /// @throws SignatureVerificationException if the stored acknowledgment is malformed
    ///         or its signature does not verify
    public Optional<SignalAck> getAck(String coordinatorId, String signalId) {
        SafeIds.requireSafe(coordinatorId, "coordinatorId");
        SafeIds.requireSafe(signalId, "signalId");
        Optional<String> raw = store.get(ackKey(coordinatorId, signalId));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Optional<SignalAck> ack = decodeAck(raw);
        if (ack.isEmpty() || !matches(ack.get(), coordinatorId, signalId)) {
            throw new SignatureVerificationException(coordinatorId, signalId);
        }
        return ack;
    }

    private boolean matches(SignalAck ack, String coordinatorId, String signalId) {
        return ack.coordinatorId().equals(coordinatorId)
                && ack.signalId().equals(signalId)
                && signer.verify(ack);
    }

    /// Checks an acknowledgment's signature in constant time.
    ///
    /// @param ack the acknowledgment, may be null
    /// @return `true` only if the signature verifies
    public boolean verifyAck(SignalAck ack) {
        return signer.verify(ack);
    }

    /// Polls until every coordinator has acknowledged the signal or the timeout elapses.
    ///
    /// Never waits past the timeout. Acknowledgments failing verification are
    /// reported through {@link CoordinationEvent.AckRejected} and count as missing.
    ///
    /// @param coordinatorIds coordinators expected to acknowledge, safe ids
    /// @param signalId the signal, safe id
    /// @param timeout upper bound on the wait, not null
    /// @return collected acknowledgments and missing coordinators, never null
    /// @throws InterruptedException if interrupted while waiting
    public AckCollection waitForAcks(
            List<String> coordinatorIds, String signalId, Duration timeout)
            throws InterruptedException {
        Objects.requireNonNull(coordinatorIds, "coordinatorIds must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        coordinatorIds.forEach(id -> SafeIds.requireSafe(id, "coordinatorId"));
        SafeIds.requireSafe(signalId, "signalId");
        List<String> expected = List.copyOf(new LinkedHashSet<>(coordinatorIds));

        Instant deadline = clock.instant().plus(timeout);
        Map<String, SignalAck> acks = new LinkedHashMap<>();
        while (true) {
            for (String coordinatorId : expected) {
                if (!acks.containsKey(coordinatorId)) {
                    collect(coordinatorId, signalId, acks);
                }
            }
            if (acks.size() == expected.size()) {
                break;
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isZero() || remaining.isNegative()) {
                break;
            }
            sleeper.sleep(
                    remaining.compareTo(config.pollInterval()) < 0
                            ? remaining
                            : config.pollInterval());
        }

        List<String> missing = new ArrayList<>();
        for (String coordinatorId : expected) {
            if (!acks.containsKey(coordinatorId)) {
                missing.add(coordinatorId);
            }
        }
        if (!missing.isEmpty()) {
            LOG.warnv(
                    "ACK wait for {0} ended with {1}/{2} acknowledgments, missing {3}",
                    signalId,
                    acks.size(),
                    expected.size(),
                    missing);
        }
        return new AckCollection(acks, missing);
    }

    private void collect(String coordinatorId, String signalId, Map<String, SignalAck> acks) {
        try {
            getAck(coordinatorId, signalId).ifPresent(ack -> acks.put(coordinatorId, ack));
        } catch (SignatureVerificationException e) {
            LOG.warnv(
                    "Rejected acknowledgment: coordinator={0}, signal={1}",
                    coordinatorId,
                    signalId);
            listeners.publish(
                    new CoordinationEvent.AckRejected(coordinatorId, signalId, clock.instant()));
        }
    }

    // --- Recovery ---

    /// Retries a failed {@link #acknowledgeSignal} with the configured backoff.
    ///
    /// Before each attempt the protocol waits the attempt's delay and records
    /// `retry:{signalId}:{attempt}`. When every attempt fails, the failure is recorded
    /// under `retry:{signalId}:failed`.
    ///
    /// @param signal the signal to acknowledge, not null
    /// @param coordinatorId acknowledging coordinator, safe id
    /// @return the stored acknowledgment, never null
    /// @throws AckRetryExhaustedException if every attempt failed
    /// @throws InterruptedException if interrupted during a backoff delay
    public SignalAck retryFailedSignal(Signal signal, String coordinatorId)
            throws InterruptedException {
        Objects.requireNonNull(signal, "signal must not be null");
        SafeIds.requireSafe(coordinatorId, "coordinatorId");
        SafeIds.requireSafe(signal.signalId(), "signalId");

        List<Duration> delays = config.retryDelays();
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= delays.size(); attempt++) {
            sleeper.sleep(delays.get(attempt - 1));
            listeners.publish(
                    new CoordinationEvent.AckRetryAttempted(
                            coordinatorId, signal.signalId(), attempt, clock.instant()));
            try {
                recordRetry(
                        signal.signalId() + ":" + attempt,
                        Map.of(
                                "coordinatorId", coordinatorId,
                                "attempt", attempt,
                                "timestamp", clock.instant().toString()));
                SignalAck ack = acknowledgeSignal(signal, coordinatorId);
                LOG.infov(
                        "Acknowledgment of {0} by {1} succeeded on attempt {2}",
                        signal.signalId(),
                        coordinatorId,
                        attempt);
                return ack;
            } catch (RuntimeException e) {
                lastError = e;
                LOG.warnv(
                        "Acknowledgment retry {0}/{1} for {2} failed: {3}",
                        attempt,
                        delays.size(),
                        signal.signalId(),
                        e.getMessage());
            }
        }

        String error = lastError != null ? String.valueOf(lastError.getMessage()) : "unknown";
        try {
            recordRetry(
                    signal.signalId() + ":failed",
                    Map.of(
                            "coordinatorId", coordinatorId,
                            "attempts", delays.size(),
                            "error", error,
                            "timestamp", clock.instant().toString()));
        } catch (RuntimeException e) {
            LOG.errorv(e, "Could not record retry failure for {0}", signal.signalId());
        }
        listeners.publish(
                new CoordinationEvent.AckRetryExhausted(
                        coordinatorId, signal.signalId(), delays.size(), error, clock.instant()));
        throw new AckRetryExhaustedException(
                coordinatorId, signal.signalId(), delays.size(), lastError);
    }

    /// Reads a retry audit record.
    ///
    /// @param signalId the signal, safe id
    /// @param attempt attempt number, or `failed`
    /// @return the stored JSON record, or empty
    public Optional<String> getRetryRecord(String signalId, String attempt) {
        SafeIds.requireSafe(signalId, "signalId");
        SafeIds.requireSafe(attempt, "attempt");
        return store.get(RETRY_PREFIX + signalId + ":" + attempt);
    }

    private void recordRetry(String suffix, Map<String, Object> record) {
        store.set(
                RETRY_PREFIX + suffix,
                CoordinationSerializer.toJson(record),
                config.retryRecordTtl());
    }

    private Optional<SignalAck> decodeAck(Optional<String> raw) {
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decodeAck(raw.get()));
        } catch (IllegalArgumentException e) {
            LOG.debugv("Malformed acknowledgment: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    static String ackKey(String coordinatorId, String signalId) {
        return ACK_PREFIX + coordinatorId + ":" + signalId;
    }
}
