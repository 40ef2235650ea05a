package io.tessera.core.store;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/// Keyed store with expiring entries shared by all coordinator processes.
///
/// This is the only channel through which independent coordinators observe each
/// other. Implementations must provide atomic single-key `get`, `set` and
/// `delete` with read-after-write visibility per key; nothing else is assumed.
/// Values are UTF-8 text, typically JSON produced by a
/// {@link io.tessera.core.signal.SignalCodec}.
///
/// ### Key Namespaces
/// - `signal:{receiverId}`: latest signal addressed to a coordinator
/// - `ack:{coordinatorId}:{signalId}`: signed acknowledgment
/// - `idempotency:{messageId}`: duplicate-send guard
/// - `retry:{signalId}:{attempt}`: retry audit trail
/// - `coordinator:activity:{coordinatorId}`: last activity timestamp
///
/// @implNote Implementations must be thread-safe.
public interface SharedStore {

    /// Reads a value.
    ///
    /// @param key the key, not null
    /// @return the value, or empty if absent or expired
    Optional<String> get(String key);

    /// Writes a value with an expiry.
    ///
    /// @param key the key, not null
    /// @param value the value, not null
    /// @param ttl time to live, positive
    void set(String key, String value, Duration ttl);

    /// Removes a key.
    ///
    /// @param key the key, not null
    /// @return `true` if a live entry was removed
    boolean delete(String key);

    /// Checks whether a live entry exists.
    ///
    /// @param key the key, not null
    /// @return `true` if present and not expired
    boolean exists(String key);

    /// Lists live keys matching a glob pattern where `*` matches any run of
    /// characters and `?` matches one character.
    ///
    /// @param pattern glob pattern, not null
    /// @return matching keys, never null
    Set<String> keysMatching(String pattern);
}
