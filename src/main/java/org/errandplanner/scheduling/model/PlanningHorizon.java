package org.errandplanner.scheduling.model;

import lombok.Value;
import org.errandplanner.core.time.TimeUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Contiguous run of whole days being planned.
 *
 * <p>Engine time is expressed in minutes since {@code startDate 00:00} local wall-clock
 * time; the horizon covers {@code [0, days * 1440)}.</p>
 */
@Value
public class PlanningHorizon {
    LocalDate startDate;
    int days;

    private PlanningHorizon(LocalDate startDate, int days) {
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        if (days <= 0) {
            throw new IllegalArgumentException("horizon days must be > 0");
        }
        this.days = days;
    }

    public static PlanningHorizon of(LocalDate startDate, int days) {
        return new PlanningHorizon(startDate, days);
    }

    /**
     * Last date covered by the horizon (inclusive).
     */
    public LocalDate lastDate() {
        return startDate.plusDays(days - 1L);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(lastDate());
    }

    public long lengthMinutes() {
        return (long) days * TimeUtils.MINUTES_PER_DAY;
    }

    /**
     * Zero-based day index of a date (may be outside {@code [0, days)}).
     */
    public int dayIndexOf(LocalDate date) {
        return (int) ChronoUnit.DAYS.between(startDate, date);
    }

    public LocalDate dateOf(int dayIndex) {
        return startDate.plusDays(dayIndex);
    }

    public LocalDate dateOfMinute(long horizonMinute) {
        return dateOf(TimeUtils.dayIndex(horizonMinute));
    }

    /**
     * Converts wall-clock time into horizon minutes (not clamped).
     */
    public long toMinute(LocalDateTime dateTime) {
        return ChronoUnit.MINUTES.between(startDate.atStartOfDay(), dateTime);
    }

    /**
     * Converts horizon minutes into wall-clock time.
     */
    public LocalDateTime toDateTime(long horizonMinute) {
        return startDate.atStartOfDay().plusMinutes(horizonMinute);
    }

    /**
     * Horizon minute at which the given date reaches a time of day.
     */
    public long minuteAt(LocalDate date, int minuteOfDay) {
        return TimeUtils.dayStart(dayIndexOf(date)) + minuteOfDay;
    }
}
