package org.errandplanner.scheduling.travel;

import lombok.Value;

/**
 * Result of one travel-time query.
 */
@Value
public class TravelEstimate {
    private static final TravelEstimate INFEASIBLE = new TravelEstimate(Integer.MAX_VALUE, false, 0);
    private static final TravelEstimate NO_TRAVEL = new TravelEstimate(0, true, 0);

    int durationMinutes;
    boolean feasible;
    /** Line changes for transit trips, {@code 0} otherwise. */
    int transfers;

    public static TravelEstimate feasible(int durationMinutes) {
        return feasible(durationMinutes, 0);
    }

    public static TravelEstimate feasible(int durationMinutes, int transfers) {
        if (durationMinutes < 0) {
            throw new IllegalArgumentException("durationMinutes must be >= 0");
        }
        if (transfers < 0) {
            throw new IllegalArgumentException("transfers must be >= 0");
        }
        return new TravelEstimate(durationMinutes, true, transfers);
    }

    public static TravelEstimate infeasible() {
        return INFEASIBLE;
    }

    public static TravelEstimate noTravel() {
        return NO_TRAVEL;
    }
}
