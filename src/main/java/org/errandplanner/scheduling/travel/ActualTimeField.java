package org.errandplanner.scheduling.travel;

/**
 * Field reported through partial actual-time feedback.
 */
public enum ActualTimeField {
    DURATION,
    TRAVEL_TIME
}
