package io.tessera.core.util;

import java.time.Duration;

/// Blocking pause used for poll intervals and retry backoff.
///
/// Injected so tests can observe or skip the waits.
@FunctionalInterface
public interface Sleeper {

    /// Sleeps on the calling thread.
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    /// Pauses for the given duration.
    ///
    /// @param duration how long to pause, not null
    /// @throws InterruptedException if the thread is interrupted while waiting
    void sleep(Duration duration) throws InterruptedException;
}
