package org.errandplanner.scheduling.core;

import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.PinnedErrand;
import org.errandplanner.scheduling.model.PlanningHorizon;
import org.errandplanner.scheduling.travel.ActualTimeField;
import org.errandplanner.scheduling.travel.CalendarProvider;

import java.util.List;

/**
 * Errand scheduling service contract.
 */
public interface ErrandScheduler {

    /**
     * Plans errands into the free time of one horizon.
     *
     * @throws SchedulingException when the pass cannot complete (for example, inputs kept changing).
     */
    default SchedulingResult schedule(List<ErrandDefinition> definitions, PlanningHorizon horizon, CalendarProvider calendar) {
        return schedule(definitions, horizon, calendar, List.of());
    }

    /**
     * Plans errands around user-confirmed occurrences, which are kept exactly as given.
     */
    SchedulingResult schedule(
            List<ErrandDefinition> definitions,
            PlanningHorizon horizon,
            CalendarProvider calendar,
            List<PinnedErrand> pinned
    );

    /**
     * Reports how long a completed errand actually took.
     */
    void reportCompletion(String instanceId, int actualDurationMinutes, int actualTravelMinutes);

    /**
     * Reports one actual time measurement for an errand.
     */
    void reportActualTime(String instanceId, ActualTimeField field, int valueMinutes);
}
