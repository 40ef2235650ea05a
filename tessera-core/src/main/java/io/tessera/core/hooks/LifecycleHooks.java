package io.tessera.core.hooks;

/// Optional callbacks around a coordinator's blocking wait for a signal.
///
/// All parameters are plain strings so implementations can forward them to
/// external scripts unchanged. Every method defaults to a no-op. Callers log
/// and suppress any exception a hook throws.
public interface LifecycleHooks {

    /// Hooks that do nothing.
    LifecycleHooks NOOP = new LifecycleHooks() {};

    /// Called when a coordinator starts waiting for a signal.
    ///
    /// @param coordinatorId the waiting coordinator
    /// @param phaseId phase the wait belongs to, may be empty
    default void onBlockingStart(String coordinatorId, String phaseId) {}

    /// Called when a wait ends without a signal.
    ///
    /// @param coordinatorId the waiting coordinator
    /// @param phaseId phase the wait belongs to, may be empty
    /// @param elapsedMillis wait duration in milliseconds, as decimal text
    default void onBlockingTimeout(String coordinatorId, String phaseId, String elapsedMillis) {}

    /// Called when a signal arrives, after it has been acknowledged.
    ///
    /// @param coordinatorId the receiving coordinator
    /// @param signalId identifier of the received signal
    /// @param signalType signal type name
    default void onSignalReceived(String coordinatorId, String signalId, String signalType) {}
}
