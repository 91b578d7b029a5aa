package org.errandplanner.scheduling.model;

import lombok.Value;
import org.errandplanner.core.time.TimeUtils;

/**
 * Time-of-day range, in minutes since midnight, inside which an errand must run.
 *
 * <p>Construction is lenient; shape checks (inverted or out-of-range windows) are
 * reported by definition validation so they surface as validation failures.</p>
 */
@Value
public class TimeWindow {
    int startMinute;
    int endMinute;

    /**
     * Creates a window from minutes since midnight.
     */
    public static TimeWindow of(int startMinute, int endMinute) {
        return new TimeWindow(startMinute, endMinute);
    }

    /**
     * Creates a window from {@code HHMM} strings such as {@code 0700} and {@code 0900}.
     */
    public static TimeWindow ofHhmm(String start, String end) {
        return new TimeWindow(TimeUtils.parseHhmm(start), TimeUtils.parseHhmm(end));
    }

    /**
     * Returns window length in minutes (may be non-positive for malformed windows).
     */
    public int lengthMinutes() {
        return endMinute - startMinute;
    }

    @Override
    public String toString() {
        return TimeUtils.formatMinuteOfDay(startMinute) + "-" + TimeUtils.formatMinuteOfDay(endMinute);
    }
}
