package org.errandplanner.scheduling.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * User-confirmed occurrence carried into a planning run.
 *
 * <p>Pinned errands occupy time, anchor recurrence spacing, and are never displaced.</p>
 */
@Value
public class PinnedErrand {
    String definitionId;
    LocalDateTime start;
    int durationMinutes;
    Place location;

    public static PinnedErrand of(String definitionId, LocalDateTime start, int durationMinutes, Place location) {
        return new PinnedErrand(definitionId, start, durationMinutes, location);
    }
}
