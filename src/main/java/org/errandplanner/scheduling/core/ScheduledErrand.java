package org.errandplanner.scheduling.core;

import lombok.Builder;
import lombok.Value;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.TravelSegment;

import java.time.LocalDateTime;

/**
 * One committed errand in wall-clock terms.
 */
@Value
@Builder
public class ScheduledErrand {
    String instanceId;
    String definitionId;
    String title;
    LocalDateTime start;
    LocalDateTime end;
    /** Resolved location; null for remote errands whose context is unknown. */
    Place location;
    /** Travel from the preceding placed item or home. */
    TravelSegment travel;
    boolean pinned;
}
