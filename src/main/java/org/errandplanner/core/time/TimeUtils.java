package org.errandplanner.core.time;

/**
 * Shared deterministic time helpers for horizon-minute arithmetic.
 *
 * <p>The planner measures time in whole minutes from the start of the planning horizon.
 * Times of day are minutes since local midnight in {@code [0, 1440]}, where {@code 1440}
 * is the end-of-day sentinel.</p>
 */
public final class TimeUtils {

    public static final int MINUTES_PER_HOUR = 60;
    public static final int MINUTES_PER_DAY = 1_440;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses an {@code HHMM} wall-clock string into minutes since midnight.
     *
     * <p>{@code 2400} is accepted as the end-of-day sentinel.</p>
     *
     * @param hhmm four-digit time such as {@code 0730}.
     * @return minutes since midnight in {@code [0, 1440]}.
     * @throws IllegalArgumentException when the string is not a valid {@code HHMM} time.
     */
    public static int parseHhmm(String hhmm) {
        if (hhmm == null || hhmm.length() != 4) {
            throw new IllegalArgumentException("time must be formatted as HHMM, got " + hhmm);
        }
        int hours;
        int minutes;
        try {
            hours = Integer.parseInt(hhmm.substring(0, 2));
            minutes = Integer.parseInt(hhmm.substring(2));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("time must be formatted as HHMM, got " + hhmm, ex);
        }
        if (hours == 24 && minutes == 0) {
            return MINUTES_PER_DAY;
        }
        if (hours < 0 || hours > 23 || minutes < 0 || minutes > 59) {
            throw new IllegalArgumentException("time out of range: " + hhmm);
        }
        return hours * MINUTES_PER_HOUR + minutes;
    }

    /**
     * Returns the day index containing one horizon minute.
     *
     * @param horizonMinute minutes since horizon start (non-negative).
     * @return zero-based day index.
     */
    public static int dayIndex(long horizonMinute) {
        return (int) Math.floorDiv(horizonMinute, MINUTES_PER_DAY);
    }

    /**
     * Returns minutes since midnight for one horizon minute.
     */
    public static int minuteOfDay(long horizonMinute) {
        return (int) Math.floorMod(horizonMinute, MINUTES_PER_DAY);
    }

    /**
     * Returns the horizon minute at which a given day starts.
     */
    public static long dayStart(int dayIndex) {
        return (long) dayIndex * MINUTES_PER_DAY;
    }

    /**
     * Returns the exclusive horizon minute at which a given day ends.
     */
    public static long dayEnd(int dayIndex) {
        return dayStart(dayIndex) + MINUTES_PER_DAY;
    }

    /**
     * Formats minutes since midnight as {@code HH:mm} (supports the {@code 24:00} sentinel).
     * Intended for logging and diagnostics.
     */
    public static String formatMinuteOfDay(int minuteOfDay) {
        if (minuteOfDay == MINUTES_PER_DAY) {
            return "24:00";
        }
        return String.format("%02d:%02d", minuteOfDay / MINUTES_PER_HOUR, minuteOfDay % MINUTES_PER_HOUR);
    }

    /**
     * Formats one horizon minute as {@code d<day> HH:mm}.
     */
    public static String formatHorizonMinute(long horizonMinute) {
        return "d" + dayIndex(horizonMinute) + " " + formatMinuteOfDay(minuteOfDay(horizonMinute));
    }
}
