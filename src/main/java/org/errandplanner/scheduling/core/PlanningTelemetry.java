package org.errandplanner.scheduling.core;

import lombok.Builder;
import lombok.Value;

/**
 * Counters collected during one successful pass.
 */
@Value
@Builder(toBuilder = true)
public class PlanningTelemetry {
    /** Instances taken from the queue. */
    int instancesProcessed;
    /** Instances placed by direct search. */
    int directPlacements;
    /** Cascade attempts started after a failed direct search. */
    int cascadeAttempts;
    /** Cascade attempts that placed their instance. */
    int cascadePlacements;
    /** Provider invocations, retries included. */
    int providerCalls;
    /** Provider invocations that failed. */
    int providerFailures;
    /** Queries that exhausted their retries and were treated as infeasible. */
    int exhaustedProviderQueries;
    /** Passes discarded because their inputs went stale. */
    int passRestarts;
}
