package org.errandplanner.scheduling.model;

import lombok.Value;

/**
 * Travel required to reach a placement from the preceding placed item or home.
 */
@Value
public class TravelSegment {
    private static final TravelSegment NONE = new TravelSegment(0, null);

    int durationMinutes;
    /** Null when no travel happens. */
    AccessType accessType;

    public static TravelSegment none() {
        return NONE;
    }

    public static TravelSegment of(int durationMinutes, AccessType accessType) {
        if (durationMinutes < 0) {
            throw new IllegalArgumentException("travel duration must be >= 0");
        }
        if (durationMinutes == 0) {
            return NONE;
        }
        return new TravelSegment(durationMinutes, accessType);
    }
}
