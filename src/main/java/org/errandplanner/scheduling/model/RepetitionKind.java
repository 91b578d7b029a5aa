package org.errandplanner.scheduling.model;

/**
 * Repetition rule families.
 */
public enum RepetitionKind {
    NONE,
    DAILY,
    EVERY_N_DAYS,
    WEEKLY,
    WEEKLY_ON_DAYS,
    MONTHLY,
    MONTHLY_ON_DAYS,
    YEARLY,
    YEARLY_ON_DAYS;

    /**
     * Returns whether dates are filtered against an explicit allowed-day set.
     */
    public boolean usesAllowedDays() {
        return this == WEEKLY_ON_DAYS || this == MONTHLY_ON_DAYS || this == YEARLY_ON_DAYS;
    }

    /**
     * Returns whether the next date depends on where the previous occurrence landed.
     */
    public boolean isPlacementDependent() {
        return this == EVERY_N_DAYS;
    }
}
