package org.errandplanner.scheduling.model;

import lombok.Value;

/**
 * Spacing constraint between consecutive occurrences of one errand, in days.
 *
 * <p>Two forms exist: a target spacing with a symmetric tolerance (for example
 * "monthly, plus or minus 3 days"), or a hard minimum gap. The tolerance also lets each
 * occurrence drift that many days from its nominal date.</p>
 */
@Value
public class IntervalRange {
    private static final IntervalRange NONE = new IntervalRange(0, 0, 0);

    int targetDays;
    int toleranceDays;
    int hardMinimumDays;

    public static IntervalRange none() {
        return NONE;
    }

    /**
     * Target spacing with tolerance; the minimum gap becomes {@code target - tolerance}.
     */
    public static IntervalRange target(int targetDays, int toleranceDays) {
        return new IntervalRange(targetDays, toleranceDays, 0);
    }

    /**
     * Date tolerance without a spacing target (one-off or calendar rules that may drift).
     */
    public static IntervalRange tolerance(int toleranceDays) {
        return new IntervalRange(0, toleranceDays, 0);
    }

    /**
     * Hard lower bound on the gap between occurrences.
     */
    public static IntervalRange minimumGap(int days) {
        return new IntervalRange(0, 0, days);
    }

    /**
     * Returns the enforced minimum number of days between two occurrences.
     */
    public int effectiveMinimumGapDays() {
        if (hardMinimumDays > 0) {
            return hardMinimumDays;
        }
        if (targetDays > 0) {
            return Math.max(0, targetDays - toleranceDays);
        }
        return 0;
    }
}
