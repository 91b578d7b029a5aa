package org.errandplanner.scheduling.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * One instance committed to the timeline.
 *
 * <p>{@code location} is null only for remote errands placed right after an opaque
 * (unlocated) blocker, where the user's whereabouts are unknown.</p>
 */
@Value
@Builder(toBuilder = true)
public class Placement {
    ErrandInstance instance;
    /** Inclusive start in horizon minutes. */
    long startMinute;
    /** Exclusive end in horizon minutes. */
    long endMinute;
    Place location;
    /** Travel from the preceding placed item or home. */
    @Builder.Default
    TravelSegment travelIn = TravelSegment.none();
    /** Travel from this placement to the next location context, as computed when committed. */
    @Builder.Default
    TravelSegment travelOut = TravelSegment.none();
    /** User-confirmed placements are never displaced. */
    boolean pinned;

    public String instanceId() {
        return instance.getId();
    }

    public String definitionId() {
        return instance.definitionId();
    }

    public int priority() {
        return instance.priority();
    }

    public long durationMinutes() {
        return endMinute - startMinute;
    }

    public Placement withTravelIn(TravelSegment segment) {
        return toBuilder().travelIn(Objects.requireNonNull(segment, "segment")).build();
    }
}
