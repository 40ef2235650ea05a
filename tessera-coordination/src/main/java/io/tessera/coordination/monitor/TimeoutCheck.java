package io.tessera.coordination.monitor;

import java.time.Duration;

/// Outcome of one timeout check.
///
/// @param coordinatorId the checked coordinator
/// @param timedOut whether the coordinator exceeded the inactivity threshold
/// @param inactiveFor time since last activity, {@link Duration#ZERO} when no record
///        exists
/// @param cleanedUp whether the coordinator's keys were removed
public record TimeoutCheck(
        String coordinatorId, boolean timedOut, Duration inactiveFor, boolean cleanedUp) {

    static TimeoutCheck active(String coordinatorId, Duration inactiveFor) {
        return new TimeoutCheck(coordinatorId, false, inactiveFor, false);
    }
}
