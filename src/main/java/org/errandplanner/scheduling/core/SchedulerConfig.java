package org.errandplanner.scheduling.core;

import lombok.Builder;
import lombok.Value;

/**
 * Deterministic bounds and tuning knobs for one planner instance.
 *
 * <p>{@link #defaults()} reads {@code errandplanner.*} system properties; blank,
 * malformed or out-of-range values fall back to the built-in defaults.</p>
 */
@Value
@Builder(toBuilder = true)
public class SchedulerConfig {
    static final int DEFAULT_CASCADE_DEPTH = 2;
    static final int DEFAULT_MAX_CASCADE_NEIGHBORS = 4;
    static final int DEFAULT_MAX_CANDIDATE_INTERVALS = 64;
    static final int DEFAULT_PROVIDER_MAX_ATTEMPTS = 3;
    static final long DEFAULT_PROVIDER_BACKOFF_MILLIS = 50L;
    static final int DEFAULT_UNKNOWN_LOCATION_PENALTY_MINUTES = 15;
    static final int DEFAULT_MAX_PASS_RESTARTS = 3;

    static final String PROP_CASCADE_DEPTH = "errandplanner.cascade.maxDepth";
    static final String PROP_MAX_CASCADE_NEIGHBORS = "errandplanner.cascade.maxNeighbors";
    static final String PROP_MAX_CANDIDATE_INTERVALS = "errandplanner.placement.maxCandidateIntervals";
    static final String PROP_PROVIDER_MAX_ATTEMPTS = "errandplanner.provider.maxAttempts";
    static final String PROP_PROVIDER_BACKOFF_MILLIS = "errandplanner.provider.backoffMillis";
    static final String PROP_UNKNOWN_LOCATION_PENALTY = "errandplanner.ledger.unknownLocationPenaltyMinutes";
    static final String PROP_MAX_PASS_RESTARTS = "errandplanner.pass.maxRestarts";

    /** Maximum displacement hops a cascade may explore. */
    @Builder.Default
    int cascadeDepth = DEFAULT_CASCADE_DEPTH;
    /** Maximum neighbours tried per cascade level. */
    @Builder.Default
    int maxCascadeNeighbors = DEFAULT_MAX_CASCADE_NEIGHBORS;
    /** Maximum free intervals evaluated per candidate date. */
    @Builder.Default
    int maxCandidateIntervals = DEFAULT_MAX_CANDIDATE_INTERVALS;
    /** Attempts per provider call before the candidate is treated as infeasible. */
    @Builder.Default
    int providerMaxAttempts = DEFAULT_PROVIDER_MAX_ATTEMPTS;
    /** Base backoff between provider attempts; doubled on every retry. */
    @Builder.Default
    long providerBackoffMillis = DEFAULT_PROVIDER_BACKOFF_MILLIS;
    /** Travel buffer added when travelling from or to an unlocated calendar event. */
    @Builder.Default
    int unknownLocationPenaltyMinutes = DEFAULT_UNKNOWN_LOCATION_PENALTY_MINUTES;
    /** Fresh passes started after stale-input cancellation before giving up. */
    @Builder.Default
    int maxPassRestarts = DEFAULT_MAX_PASS_RESTARTS;

    /**
     * Loads configuration from system properties.
     */
    public static SchedulerConfig defaults() {
        return SchedulerConfig.builder()
                .cascadeDepth(readInt(PROP_CASCADE_DEPTH, DEFAULT_CASCADE_DEPTH, 0))
                .maxCascadeNeighbors(readInt(PROP_MAX_CASCADE_NEIGHBORS, DEFAULT_MAX_CASCADE_NEIGHBORS, 1))
                .maxCandidateIntervals(readInt(PROP_MAX_CANDIDATE_INTERVALS, DEFAULT_MAX_CANDIDATE_INTERVALS, 1))
                .providerMaxAttempts(readInt(PROP_PROVIDER_MAX_ATTEMPTS, DEFAULT_PROVIDER_MAX_ATTEMPTS, 1))
                .providerBackoffMillis(readInt(PROP_PROVIDER_BACKOFF_MILLIS, (int) DEFAULT_PROVIDER_BACKOFF_MILLIS, 0))
                .unknownLocationPenaltyMinutes(
                        readInt(PROP_UNKNOWN_LOCATION_PENALTY, DEFAULT_UNKNOWN_LOCATION_PENALTY_MINUTES, 0))
                .maxPassRestarts(readInt(PROP_MAX_PASS_RESTARTS, DEFAULT_MAX_PASS_RESTARTS, 0))
                .build();
    }

    private static int readInt(String property, int fallback, int minimum) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value < minimum ? fallback : value;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
