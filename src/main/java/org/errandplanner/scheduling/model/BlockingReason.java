package org.errandplanner.scheduling.model;

/**
 * Constraint that kept an instance from being placed, offered to the user as a decision point.
 */
public enum BlockingReason {
    /** No free interval inside the valid window was long enough. */
    TIME_WINDOW_CONFLICT,
    /** Time fitted but travel with the chosen access type was infeasible or too long. */
    ACCESS_TYPE_INFEASIBLE,
    /** Every candidate date was too close to another occurrence of the same errand. */
    INTERVAL_SPACING_CONFLICT,
    /** Every remaining candidate date already holds a conflicting errand. */
    CONFLICTING_ERRAND,
    /** Every remaining candidate date missed a same-day complementary errand. */
    COMPLEMENTARY_REQUIREMENT
}
