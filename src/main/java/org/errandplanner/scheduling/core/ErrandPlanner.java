package org.errandplanner.scheduling.core;

import lombok.Builder;
import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.PinnedErrand;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.PlanningHorizon;
import org.errandplanner.scheduling.travel.ActualTimeField;
import org.errandplanner.scheduling.travel.CalendarProvider;
import org.errandplanner.scheduling.travel.EstimationFeedback;
import org.errandplanner.scheduling.travel.LocationResolver;
import org.errandplanner.scheduling.travel.TravelTimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Main errand-planning entry point.
 *
 * <p>The facade applies request validation before any pass starts and normalizes engine
 * failures to {@link SchedulingException} with stable reason codes. Execution flow:</p>
 * <ul>
 * <li>Check the request shape (definitions, horizon, calendar, pinned list).</li>
 * <li>Run one pass through {@link PriorityScheduler}.</li>
 * <li>When the pass is cancelled because the calendar changed, start a fresh pass, up to
 *     the configured number of restarts.</li>
 * <li>Forward completion feedback to the estimation collaborator.</li>
 * </ul>
 */
public final class ErrandPlanner implements ErrandScheduler {
    private static final Logger log = LoggerFactory.getLogger(ErrandPlanner.class);

    public static final String REASON_DEFINITIONS_REQUIRED = "EP_DEFINITIONS_REQUIRED";
    public static final String REASON_HORIZON_REQUIRED = "EP_HORIZON_REQUIRED";
    public static final String REASON_CALENDAR_REQUIRED = "EP_CALENDAR_REQUIRED";
    public static final String REASON_PINNED_REQUIRED = "EP_PINNED_REQUIRED";
    public static final String REASON_PASS_CANCELLED = "EP_PASS_CANCELLED";
    public static final String REASON_INPUT_UNSTABLE = "EP_INPUT_UNSTABLE";
    public static final String REASON_INSTANCE_ID_REQUIRED = "EP_INSTANCE_ID_REQUIRED";
    public static final String REASON_FEEDBACK_FIELD_REQUIRED = "EP_FEEDBACK_FIELD_REQUIRED";
    public static final String REASON_FEEDBACK_NEGATIVE = "EP_FEEDBACK_NEGATIVE";

    private final PriorityScheduler scheduler;
    private final EstimationFeedback estimationFeedback;
    private final SchedulerConfig config;

    /**
     * Creates the planner facade.
     *
     * @param home where each day starts and ends.
     * @param travelTimeProvider directions collaborator.
     * @param locationResolver optional places collaborator (required for store-category errands).
     * @param estimationFeedback optional feedback sink (defaults to discarding).
     * @param config optional configuration (defaults to {@link SchedulerConfig#defaults()}).
     * @param executor optional executor for concurrent provider lookups.
     */
    @Builder
    public ErrandPlanner(
            Place home,
            TravelTimeProvider travelTimeProvider,
            LocationResolver locationResolver,
            EstimationFeedback estimationFeedback,
            SchedulerConfig config,
            Executor executor
    ) {
        this.config = config == null ? SchedulerConfig.defaults() : config;
        this.scheduler = new PriorityScheduler(
                Objects.requireNonNull(home, "home"),
                Objects.requireNonNull(travelTimeProvider, "travelTimeProvider"),
                locationResolver,
                this.config,
                executor
        );
        this.estimationFeedback = estimationFeedback == null ? EstimationFeedback.discarding() : estimationFeedback;
    }

    public SchedulerConfig config() {
        return config;
    }

    /**
     * Plans errands, restarting passes whose inputs changed mid-run.
     *
     * @throws SchedulingException when the request is malformed, the calendar is unreadable,
     *                             or the inputs kept changing through every restart.
     */
    @Override
    public SchedulingResult schedule(
            List<ErrandDefinition> definitions,
            PlanningHorizon horizon,
            CalendarProvider calendar,
            List<PinnedErrand> pinned
    ) {
        if (definitions == null) {
            throw new SchedulingException(REASON_DEFINITIONS_REQUIRED, "definitions must be provided");
        }
        if (horizon == null) {
            throw new SchedulingException(REASON_HORIZON_REQUIRED, "planning horizon must be provided");
        }
        if (calendar == null) {
            throw new SchedulingException(REASON_CALENDAR_REQUIRED, "calendar provider must be provided");
        }
        if (pinned == null) {
            throw new SchedulingException(REASON_PINNED_REQUIRED, "pinned list must be provided (may be empty)");
        }

        int restarts = 0;
        while (true) {
            try {
                SchedulingResult result = scheduler.run(definitions, horizon, calendar, pinned);
                if (restarts == 0) {
                    return result;
                }
                return result.toBuilder()
                        .telemetry(result.getTelemetry().toBuilder().passRestarts(restarts).build())
                        .build();
            } catch (PlanningCancelledException ex) {
                if (restarts >= config.getMaxPassRestarts()) {
                    throw new SchedulingException(
                            REASON_INPUT_UNSTABLE,
                            "inputs changed during " + (restarts + 1) + " consecutive passes",
                            ex
                    );
                }
                restarts++;
                log.warn("Planning pass cancelled ({}), restarting ({}/{})",
                        ex.getMessage(), restarts, config.getMaxPassRestarts());
            }
        }
    }

    /**
     * Forwards actual duration and travel of a completed errand; past schedules are untouched.
     */
    @Override
    public void reportCompletion(String instanceId, int actualDurationMinutes, int actualTravelMinutes) {
        requireInstanceId(instanceId);
        requireNonNegative("actual duration", actualDurationMinutes);
        requireNonNegative("actual travel time", actualTravelMinutes);
        estimationFeedback.recordCompletion(instanceId, actualDurationMinutes, actualTravelMinutes);
    }

    /**
     * Forwards one actual time measurement.
     */
    @Override
    public void reportActualTime(String instanceId, ActualTimeField field, int valueMinutes) {
        requireInstanceId(instanceId);
        if (field == null) {
            throw new SchedulingException(REASON_FEEDBACK_FIELD_REQUIRED, "feedback field must be provided");
        }
        requireNonNegative(field.name().toLowerCase(Locale.ROOT), valueMinutes);
        estimationFeedback.recordActual(instanceId, field, valueMinutes);
    }

    private static void requireInstanceId(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new SchedulingException(REASON_INSTANCE_ID_REQUIRED, "instance id must be non-blank");
        }
    }

    private static void requireNonNegative(String label, int valueMinutes) {
        if (valueMinutes < 0) {
            throw new SchedulingException(REASON_FEEDBACK_NEGATIVE, label + " must be >= 0, got " + valueMinutes);
        }
    }
}
