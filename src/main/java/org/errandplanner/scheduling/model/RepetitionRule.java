package org.errandplanner.scheduling.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Set;

/**
 * Repetition rule of an errand definition.
 *
 * <p>{@code interval} counts rule units (days, weeks, months or years). The anchor date
 * fixes the phase of the rule; when absent the horizon start is used.</p>
 */
@Value
@Builder
public class RepetitionRule {
    /** Rule family. */
    RepetitionKind kind;
    /** Step between occurrences in rule units; {@code 2} with weekly-on-days is biweekly. */
    @Builder.Default
    int interval = 1;
    /** Optional phase anchor. */
    LocalDate anchorDate;
    /** Allowed weekdays for {@link RepetitionKind#WEEKLY_ON_DAYS}. */
    @Singular("dayOfWeek")
    Set<DayOfWeek> daysOfWeek;
    /** Allowed days of month (1..31) for {@link RepetitionKind#MONTHLY_ON_DAYS}. */
    @Singular("dayOfMonth")
    Set<Integer> daysOfMonth;
    /** Allowed month-days for {@link RepetitionKind#YEARLY_ON_DAYS}. */
    @Singular("monthDay")
    Set<MonthDay> monthDays;

    public static RepetitionRule none() {
        return RepetitionRule.builder().kind(RepetitionKind.NONE).build();
    }

    public static RepetitionRule daily() {
        return RepetitionRule.builder().kind(RepetitionKind.DAILY).build();
    }

    public static RepetitionRule everyNDays(int days) {
        return RepetitionRule.builder().kind(RepetitionKind.EVERY_N_DAYS).interval(days).build();
    }

    public static RepetitionRule weekly() {
        return RepetitionRule.builder().kind(RepetitionKind.WEEKLY).build();
    }

    public static RepetitionRule weeklyOn(DayOfWeek... days) {
        return RepetitionRule.builder().kind(RepetitionKind.WEEKLY_ON_DAYS).daysOfWeek(Set.of(days)).build();
    }

    public static RepetitionRule monthly() {
        return RepetitionRule.builder().kind(RepetitionKind.MONTHLY).build();
    }

    public static RepetitionRule yearly() {
        return RepetitionRule.builder().kind(RepetitionKind.YEARLY).build();
    }
}
