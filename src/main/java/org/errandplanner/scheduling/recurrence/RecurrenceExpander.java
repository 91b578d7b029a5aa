package org.errandplanner.scheduling.recurrence;

import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.ErrandInstance;
import org.errandplanner.scheduling.model.IntervalRange;
import org.errandplanner.scheduling.model.PlanningHorizon;
import org.errandplanner.scheduling.model.RepetitionKind;
import org.errandplanner.scheduling.model.RepetitionRule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Expands errand definitions into lazy per-definition instance sequences.
 *
 * <p>Calendar rules are evaluated as a date predicate over the horizon, so expansion cost
 * is proportional to the horizon, never to the distance from the anchor date. Each
 * yielded instance may land anywhere in its target date widened by the interval-range
 * tolerance; one-off errands may land on any horizon day from their target onwards.</p>
 */
public final class RecurrenceExpander {
    public static final String REASON_RULE_REQUIRED = "ER_RULE_REQUIRED";
    public static final String REASON_INTERVAL_NOT_POSITIVE = "ER_INTERVAL_NOT_POSITIVE";
    public static final String REASON_ALLOWED_DAYS_EMPTY = "ER_ALLOWED_DAYS_EMPTY";
    public static final String REASON_DAY_OF_MONTH_RANGE = "ER_DAY_OF_MONTH_RANGE";
    public static final String REASON_INTERVAL_RANGE_INVALID = "ER_INTERVAL_RANGE_INVALID";
    public static final String REASON_MINIMUM_GAP_EXCEEDS_HORIZON = "ER_MINIMUM_GAP_EXCEEDS_HORIZON";

    /**
     * Expands one definition with no prior occurrences.
     */
    public RecurrenceSequence expand(ErrandDefinition definition, PlanningHorizon horizon) {
        return expand(definition, horizon, List.of());
    }

    /**
     * Expands one definition.
     *
     * @param definition validated definition.
     * @param horizon planning horizon.
     * @param priorOccurrences dates of confirmed earlier occurrences (any order, may be inside the horizon).
     * @return lazy instance sequence.
     * @throws InvalidRecurrenceException when the repetition rule is internally inconsistent.
     */
    public RecurrenceSequence expand(
            ErrandDefinition definition,
            PlanningHorizon horizon,
            Collection<LocalDate> priorOccurrences
    ) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(horizon, "horizon");
        validateRule(definition);

        TreeSet<LocalDate> priors = new TreeSet<>(Objects.requireNonNull(priorOccurrences, "priorOccurrences"));
        RepetitionRule rule = definition.getRepetition();
        AbstractSequence sequence = rule.getKind().isPlacementDependent()
                ? new IntervalSequence(definition, horizon, priors)
                : new CalendarSequence(definition, horizon, priors, calendarPredicate(rule, horizon));

        int minimumGap = definition.getIntervalRange().effectiveMinimumGapDays();
        if (minimumGap > horizon.getDays() && !sequence.hasCandidate()) {
            throw new InvalidRecurrenceException(
                    definition.getId(),
                    REASON_MINIMUM_GAP_EXCEEDS_HORIZON,
                    "minimum interval of " + minimumGap + " days exceeds the " + horizon.getDays()
                            + "-day horizon and leaves no valid date for " + definition.getId()
            );
        }
        return sequence;
    }

    private static void validateRule(ErrandDefinition definition) {
        String id = definition.getId();
        RepetitionRule rule = definition.getRepetition();
        if (rule == null || rule.getKind() == null) {
            throw new InvalidRecurrenceException(id, REASON_RULE_REQUIRED, "repetition rule kind is required");
        }
        if (rule.getInterval() < 1) {
            throw new InvalidRecurrenceException(
                    id, REASON_INTERVAL_NOT_POSITIVE, "repeat interval must be >= 1, got " + rule.getInterval());
        }
        switch (rule.getKind()) {
            case WEEKLY_ON_DAYS -> requireNonEmpty(id, rule.getDaysOfWeek(), "weekday");
            case MONTHLY_ON_DAYS -> {
                requireNonEmpty(id, rule.getDaysOfMonth(), "day-of-month");
                for (Integer day : rule.getDaysOfMonth()) {
                    if (day == null || day < 1 || day > 31) {
                        throw new InvalidRecurrenceException(
                                id, REASON_DAY_OF_MONTH_RANGE, "day of month must be in [1, 31], got " + day);
                    }
                }
            }
            case YEARLY_ON_DAYS -> requireNonEmpty(id, rule.getMonthDays(), "month-day");
            default -> {
            }
        }

        IntervalRange range = definition.getIntervalRange();
        if (range == null) {
            throw new InvalidRecurrenceException(id, REASON_INTERVAL_RANGE_INVALID, "interval range is required");
        }
        if (range.getTargetDays() < 0 || range.getToleranceDays() < 0 || range.getHardMinimumDays() < 0) {
            throw new InvalidRecurrenceException(
                    id, REASON_INTERVAL_RANGE_INVALID, "interval range values must be >= 0");
        }
        if (range.getTargetDays() > 0 && range.getToleranceDays() >= range.getTargetDays()) {
            throw new InvalidRecurrenceException(
                    id, REASON_INTERVAL_RANGE_INVALID, "tolerance must be smaller than the target spacing");
        }
        if (rule.getKind() == RepetitionKind.EVERY_N_DAYS && range.getToleranceDays() >= rule.getInterval()) {
            throw new InvalidRecurrenceException(
                    id, REASON_INTERVAL_RANGE_INVALID, "tolerance must be smaller than the repeat interval");
        }
    }

    private static void requireNonEmpty(String id, Collection<?> values, String label) {
        if (values == null || values.isEmpty()) {
            throw new InvalidRecurrenceException(
                    id, REASON_ALLOWED_DAYS_EMPTY, "allowed " + label + " set must not be empty");
        }
    }

    /**
     * Builds the membership predicate for calendar rules; {@code NONE} matches its single target.
     */
    private static Predicate<LocalDate> calendarPredicate(RepetitionRule rule, PlanningHorizon horizon) {
        LocalDate anchor = rule.getAnchorDate() == null ? horizon.getStartDate() : rule.getAnchorDate();
        int step = rule.getInterval();
        return switch (rule.getKind()) {
            case NONE -> {
                LocalDate target = anchor.isBefore(horizon.getStartDate()) ? horizon.getStartDate() : anchor;
                yield date -> date.equals(target);
            }
            case DAILY -> date -> onOrAfter(date, anchor) && ChronoUnit.DAYS.between(anchor, date) % step == 0;
            case WEEKLY -> date -> onOrAfter(date, anchor) && ChronoUnit.DAYS.between(anchor, date) % (7L * step) == 0;
            case WEEKLY_ON_DAYS -> {
                LocalDate anchorMonday = anchor.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                yield date -> onOrAfter(date, anchor)
                        && rule.getDaysOfWeek().contains(date.getDayOfWeek())
                        && (ChronoUnit.DAYS.between(anchorMonday, date) / 7) % step == 0;
            }
            case MONTHLY -> date -> onOrAfter(date, anchor)
                    && monthsBetween(anchor, date) % step == 0
                    && date.getDayOfMonth() == Math.min(anchor.getDayOfMonth(), date.lengthOfMonth());
            case MONTHLY_ON_DAYS -> date -> onOrAfter(date, anchor)
                    && monthsBetween(anchor, date) % step == 0
                    && matchesDayOfMonth(rule, date);
            case YEARLY -> date -> onOrAfter(date, anchor)
                    && (date.getYear() - anchor.getYear()) % step == 0
                    && MonthDay.from(anchor).atYear(date.getYear()).equals(date);
            case YEARLY_ON_DAYS -> date -> onOrAfter(date, anchor)
                    && (date.getYear() - anchor.getYear()) % step == 0
                    && rule.getMonthDays().stream().anyMatch(monthDay -> monthDay.atYear(date.getYear()).equals(date));
            case EVERY_N_DAYS -> throw new IllegalArgumentException("EVERY_N_DAYS is placement dependent");
        };
    }

    private static boolean matchesDayOfMonth(RepetitionRule rule, LocalDate date) {
        int day = date.getDayOfMonth();
        if (rule.getDaysOfMonth().contains(day)) {
            return true;
        }
        // Days past the end of a short month collapse onto its last day.
        if (day == date.lengthOfMonth()) {
            for (Integer allowed : rule.getDaysOfMonth()) {
                if (allowed > day) {
                    return true;
                }
            }
        }
        return false;
    }

    private static long monthsBetween(LocalDate anchor, LocalDate date) {
        return ChronoUnit.MONTHS.between(YearMonth.from(anchor), YearMonth.from(date));
    }

    private static boolean onOrAfter(LocalDate date, LocalDate anchor) {
        return !date.isBefore(anchor);
    }

    /**
     * Shared landing-range arithmetic.
     */
    private abstract static class AbstractSequence implements RecurrenceSequence {
        final ErrandDefinition definition;
        final PlanningHorizon horizon;
        final TreeSet<LocalDate> occupied;
        final int toleranceDays;
        final int minimumGapDays;

        AbstractSequence(ErrandDefinition definition, PlanningHorizon horizon, TreeSet<LocalDate> priors) {
            this.definition = definition;
            this.horizon = horizon;
            this.occupied = priors;
            this.toleranceDays = definition.getIntervalRange().getToleranceDays();
            this.minimumGapDays = definition.getIntervalRange().effectiveMinimumGapDays();
        }

        abstract boolean hasCandidate();

        /**
         * Builds the instance for a target date, or empty when spacing leaves no landing date.
         */
        Optional<ErrandInstance> instanceFor(LocalDate target) {
            if (occupied.contains(target)) {
                return Optional.empty();
            }
            LocalDate earliest = target.minusDays(toleranceDays);
            LocalDate latest = definition.getRepetition().getKind() == RepetitionKind.NONE
                    ? horizon.lastDate()
                    : target.plusDays(toleranceDays);
            if (earliest.isBefore(horizon.getStartDate())) {
                earliest = horizon.getStartDate();
            }
            if (latest.isAfter(horizon.lastDate())) {
                latest = horizon.lastDate();
            }
            if (minimumGapDays > 0) {
                LocalDate before = occupied.floor(target);
                if (before != null && before.plusDays(minimumGapDays).isAfter(earliest)) {
                    earliest = before.plusDays(minimumGapDays);
                }
                LocalDate after = occupied.ceiling(target);
                if (after != null && after.minusDays(minimumGapDays).isBefore(latest)) {
                    latest = after.minusDays(minimumGapDays);
                }
            }
            if (latest.isBefore(earliest)) {
                return Optional.empty();
            }
            return Optional.of(ErrandInstance.of(definition, target, earliest, latest));
        }

        @Override
        public void confirm(ErrandInstance instance, LocalDate placedDate) {
            occupied.add(Objects.requireNonNull(placedDate, "placedDate"));
        }

        @Override
        public boolean relocate(ErrandInstance instance, LocalDate fromDate, LocalDate toDate) {
            Objects.requireNonNull(instance, "instance");
            occupied.remove(Objects.requireNonNull(fromDate, "fromDate"));
            occupied.add(Objects.requireNonNull(toDate, "toDate"));
            return false;
        }

        @Override
        public void skip(ErrandInstance instance) {
            Objects.requireNonNull(instance, "instance");
        }
    }

    /**
     * Calendar rule: scans horizon dates lazily against a membership predicate.
     */
    private static final class CalendarSequence extends AbstractSequence {
        private final Predicate<LocalDate> predicate;
        private LocalDate cursor;

        CalendarSequence(
                ErrandDefinition definition,
                PlanningHorizon horizon,
                TreeSet<LocalDate> priors,
                Predicate<LocalDate> predicate
        ) {
            super(definition, horizon, priors);
            this.predicate = predicate;
            this.cursor = horizon.getStartDate();
        }

        @Override
        boolean hasCandidate() {
            for (LocalDate date = cursor; !date.isAfter(horizon.lastDate()); date = date.plusDays(1)) {
                if (predicate.test(date) && instanceFor(date).isPresent()) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Optional<ErrandInstance> next() {
            while (!cursor.isAfter(horizon.lastDate())) {
                LocalDate date = cursor;
                cursor = cursor.plusDays(1);
                if (predicate.test(date)) {
                    Optional<ErrandInstance> instance = instanceFor(date);
                    if (instance.isPresent()) {
                        return instance;
                    }
                }
            }
            return Optional.empty();
        }

        @Override
        public boolean exhausted() {
            return cursor.isAfter(horizon.lastDate());
        }
    }

    /**
     * Placement-dependent rule: the next target is N days after the last confirmed date
     * (or after the skipped target when nothing was confirmed since).
     */
    private static final class IntervalSequence extends AbstractSequence {
        private final int stepDays;
        private LocalDate nextTarget;
        private ErrandInstance outstanding;
        private String lastConfirmedId;

        IntervalSequence(ErrandDefinition definition, PlanningHorizon horizon, TreeSet<LocalDate> priors) {
            super(definition, horizon, priors);
            this.stepDays = definition.getRepetition().getInterval();
            this.nextTarget = firstTarget(definition, horizon, priors);
        }

        private LocalDate firstTarget(ErrandDefinition definition, PlanningHorizon horizon, TreeSet<LocalDate> priors) {
            LocalDate start = horizon.getStartDate();
            LocalDate lastBefore = priors.floor(start);
            if (lastBefore != null) {
                LocalDate due = lastBefore.plusDays(stepDays);
                // Overdue errands are due at the start of the horizon.
                return due.isBefore(start) ? start : due;
            }
            LocalDate anchor = definition.getRepetition().getAnchorDate();
            if (anchor == null || !anchor.isBefore(start)) {
                return anchor == null ? start : anchor;
            }
            long behind = ChronoUnit.DAYS.between(anchor, start);
            long steps = (behind + stepDays - 1) / stepDays;
            return anchor.plusDays(steps * stepDays);
        }

        @Override
        boolean hasCandidate() {
            return nextTarget != null
                    && !nextTarget.isAfter(horizon.lastDate())
                    && instanceFor(nextTarget).isPresent();
        }

        @Override
        public Optional<ErrandInstance> next() {
            while (outstanding == null && nextTarget != null && !nextTarget.isAfter(horizon.lastDate())) {
                LocalDate target = nextTarget;
                Optional<ErrandInstance> instance = instanceFor(target);
                if (instance.isPresent()) {
                    outstanding = instance.get();
                    return instance;
                }
                nextTarget = target.plusDays(stepDays);
            }
            return Optional.empty();
        }

        @Override
        public void confirm(ErrandInstance instance, LocalDate placedDate) {
            requireOutstanding(instance);
            super.confirm(instance, placedDate);
            outstanding = null;
            lastConfirmedId = instance.getId();
            nextTarget = placedDate.plusDays(stepDays);
        }

        /**
         * Only a move of the latest confirmed occurrence shifts the next target.
         */
        @Override
        public boolean relocate(ErrandInstance instance, LocalDate fromDate, LocalDate toDate) {
            super.relocate(instance, fromDate, toDate);
            if (fromDate.equals(toDate) || !instance.getId().equals(lastConfirmedId)) {
                return false;
            }
            outstanding = null;
            nextTarget = toDate.plusDays(stepDays);
            return true;
        }

        @Override
        public void skip(ErrandInstance instance) {
            requireOutstanding(instance);
            outstanding = null;
            nextTarget = instance.getTargetDate().plusDays(stepDays);
        }

        @Override
        public boolean exhausted() {
            return outstanding == null && (nextTarget == null || nextTarget.isAfter(horizon.lastDate()));
        }

        private void requireOutstanding(ErrandInstance instance) {
            if (outstanding == null || !outstanding.getId().equals(instance.getId())) {
                throw new IllegalStateException("instance " + instance.getId() + " is not outstanding");
            }
        }
    }
}
