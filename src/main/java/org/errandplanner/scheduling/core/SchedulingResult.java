package org.errandplanner.scheduling.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Complete outcome of one scheduling run.
 *
 * <p>{@code placed} is in timeline order; {@code unschedulable} is in processing order.</p>
 */
@Value
@Builder(toBuilder = true)
public class SchedulingResult {
    @Singular("placedErrand")
    List<ScheduledErrand> placed;
    @Singular("unschedulableErrand")
    List<UnschedulableErrand> unschedulable;
    @Singular
    List<RejectedDefinition> rejectedDefinitions;
    PlanningTelemetry telemetry;
}
