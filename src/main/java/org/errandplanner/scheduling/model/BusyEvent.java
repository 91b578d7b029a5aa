package org.errandplanner.scheduling.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Existing calendar commitment.
 *
 * <p>Events without a location block time opaquely unless the user flagged them
 * ignorable, in which case they do not block at all.</p>
 */
@Value
@Builder
public class BusyEvent {
    String title;
    LocalDateTime start;
    LocalDateTime end;
    Place location;
    boolean ignorable;

    public static BusyEvent located(String title, LocalDateTime start, LocalDateTime end, Place location) {
        return BusyEvent.builder().title(title).start(start).end(end).location(location).build();
    }

    public static BusyEvent unlocated(String title, LocalDateTime start, LocalDateTime end) {
        return BusyEvent.builder().title(title).start(start).end(end).build();
    }

    public boolean isLocated() {
        return location != null;
    }
}
