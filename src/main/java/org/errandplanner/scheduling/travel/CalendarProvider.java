package org.errandplanner.scheduling.travel;

import org.errandplanner.scheduling.model.BusyEvent;
import org.errandplanner.scheduling.model.PlanningHorizon;

import java.util.List;

/**
 * External calendar collaborator.
 */
public interface CalendarProvider {

    /**
     * Returns busy events overlapping the horizon.
     */
    List<BusyEvent> busyEvents(PlanningHorizon horizon);

    /**
     * Monotonic revision of the calendar contents; a change mid-pass cancels the pass.
     */
    default long revision() {
        return 0L;
    }

    /**
     * Fixed in-memory calendar.
     */
    static CalendarProvider of(List<BusyEvent> events) {
        List<BusyEvent> copy = List.copyOf(events);
        return horizon -> copy;
    }
}
