package io.tessera.coordination.monitor;

import java.time.Instant;
import java.util.Objects;

/// Last recorded activity of a coordinator, stored as JSON under
/// `coordinator:activity:{coordinatorId}`.
///
/// @param coordinatorId the coordinator, not null
/// @param lastActivity time of the activity, not null
/// @param iteration iteration the coordinator was in, not negative
/// @param phase phase the coordinator was in, may be null
public record CoordinatorActivity(
        String coordinatorId, Instant lastActivity, int iteration, String phase) {

    public CoordinatorActivity {
        Objects.requireNonNull(coordinatorId, "coordinatorId must not be null");
        Objects.requireNonNull(lastActivity, "lastActivity must not be null");
        if (iteration < 0) {
            throw new IllegalArgumentException("iteration must not be negative");
        }
    }
}
