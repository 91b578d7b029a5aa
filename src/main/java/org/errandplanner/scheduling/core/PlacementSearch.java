package org.errandplanner.scheduling.core;

import org.errandplanner.core.time.TimeUtils;
import org.errandplanner.scheduling.ledger.FreeInterval;
import org.errandplanner.scheduling.model.AccessType;
import org.errandplanner.scheduling.model.BlockingReason;
import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.ErrandInstance;
import org.errandplanner.scheduling.model.LocationKind;
import org.errandplanner.scheduling.model.LocationSpec;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.Placement;
import org.errandplanner.scheduling.model.PlanningHorizon;
import org.errandplanner.scheduling.model.RepetitionRule;
import org.errandplanner.scheduling.model.TimeWindow;
import org.errandplanner.scheduling.model.TravelSegment;
import org.errandplanner.scheduling.state.ScheduleState;
import org.errandplanner.scheduling.state.ScheduleWorkspace;
import org.errandplanner.scheduling.travel.LocationCandidate;
import org.errandplanner.scheduling.travel.TravelEstimate;
import org.errandplanner.scheduling.travel.TravelGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Finds the best feasible (time, location) pair for one instance against a workspace.
 *
 * <p>Search flow:</p>
 * <ul>
 * <li>Screen the instance's landing dates: allowed days, same-definition spacing,
 *     same-day exclusion against conflicting definitions, then same-day pairing with
 *     complementary definitions.</li>
 * <li>For each surviving date, evaluate free intervals that intersect the valid window
 *     (bounded per date) against the location kind: fixed, remote, or store category.
 *     An ordered complementary pair moves the window start past its partner's end.</li>
 * <li>Rank fits by complementary place match, added travel, excess transit transfers,
 *     transfers, start, then label.</li>
 * <li>Retry once with the minimum duration when nothing fits at the estimated one.</li>
 * </ul>
 *
 * <p>The search never writes to the workspace. Interval evaluations may run on the
 * configured executor; their results are combined in interval order, so the outcome does
 * not depend on thread scheduling.</p>
 */
public final class PlacementSearch {
    private static final Logger log = LoggerFactory.getLogger(PlacementSearch.class);

    private static final Comparator<Fit> FIT_ORDER = Comparator
            .comparingInt(Fit::locationMismatch)
            .thenComparingLong(Fit::addedTravel)
            .thenComparingInt(Fit::excessTransfers)
            .thenComparingInt(Fit::transfers)
            .thenComparingLong(fit -> fit.placement().getStartMinute())
            .thenComparing(Fit::label);

    private final TravelLegEstimator legs;
    private final PlanningHorizon horizon;
    private final int maxCandidateIntervals;
    private final Executor executor;

    /**
     * Creates a search bound to one planning pass.
     *
     * @param gateway pass-scoped travel gateway.
     * @param horizon planning horizon.
     * @param home where every day starts.
     * @param config bounds and unknown-location penalty.
     * @param executor optional executor for interval evaluation (null runs inline).
     */
    public PlacementSearch(
            TravelGateway gateway,
            PlanningHorizon horizon,
            Place home,
            SchedulerConfig config,
            Executor executor
    ) {
        Objects.requireNonNull(config, "config");
        this.legs = new TravelLegEstimator(gateway, horizon, home, config.getUnknownLocationPenaltyMinutes());
        this.horizon = horizon;
        this.maxCandidateIntervals = config.getMaxCandidateIntervals();
        this.executor = executor;
    }

    TravelLegEstimator legs() {
        return legs;
    }

    /**
     * Searches a placement for one instance.
     *
     * @param instance instance to place (not yet in the workspace).
     * @param workspace workspace to search; not modified.
     * @return scheduled placement, or failure with the dominant blocking reason.
     */
    public PlacementResult place(ErrandInstance instance, ScheduleWorkspace workspace) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(workspace, "workspace");
        ErrandDefinition definition = instance.getDefinition();

        DateScreen screen = screenDates(instance, workspace.state());
        if (screen.dates().isEmpty()) {
            log.debug("Placement: {} has no landing date left ({})", instance.getId(), screen.reason());
            return PlacementResult.failed(screen.reason());
        }

        Outcome full = search(instance, screen.dates(), definition.getEstimatedDurationMinutes(), workspace);
        if (full.best() != null) {
            return PlacementResult.scheduled(full.best().placement());
        }
        boolean travelBlocked = full.travelBlocked();

        Integer minimum = definition.getMinimumDurationMinutes();
        if (minimum != null && minimum < definition.getEstimatedDurationMinutes()) {
            Outcome reduced = search(instance, screen.dates(), minimum, workspace);
            if (reduced.best() != null) {
                log.debug("Placement: {} placed at reduced duration {} min", instance.getId(), minimum);
                return PlacementResult.scheduled(reduced.best().placement());
            }
            travelBlocked |= reduced.travelBlocked();
        }
        BlockingReason reason = travelBlocked
                ? BlockingReason.ACCESS_TYPE_INFEASIBLE
                : BlockingReason.TIME_WINDOW_CONFLICT;
        log.debug("Placement: {} has no feasible slot ({})", instance.getId(), reason);
        return PlacementResult.failed(reason);
    }

    /**
     * Recomputes the travel-in of the placement that directly follows a withdrawn one.
     *
     * <p>Remote placements stand wherever the user already is, so a run of them right after
     * the withdrawn slot takes over the slot's origin and the first located placement after
     * the run is re-checked from there.</p>
     *
     * @return false when the successor can no longer be reached in time.
     */
    public boolean refreshTravelAfter(ScheduleWorkspace workspace, Placement withdrawn) {
        Optional<FreeInterval> interval = workspace.freeIntervalAt(withdrawn.getStartMinute());
        if (interval.isEmpty() || interval.get().isEndOfDay()) {
            return true;
        }
        FreeInterval gap = interval.get();
        Optional<Placement> successor = workspace.state().startingAt(gap.getEndMinute());
        if (successor.isEmpty()) {
            return true;
        }
        Placement next = successor.get();
        if (isRemote(next)) {
            return relocateRemoteRun(workspace, next, gap.isOriginOpaque() ? null : gap.getOrigin());
        }
        ErrandDefinition nextDefinition = next.getInstance().getDefinition();
        AccessType accessType = nextDefinition.getAccessType();
        TravelEstimate in = legs.leg(
                gap.getOrigin(), gap.isOriginOpaque(), next.getLocation(), next.getLocation() == null,
                accessType, gap.getStartMinute());
        if (!in.isFeasible() || gap.getStartMinute() + in.getDurationMinutes() > next.getStartMinute()) {
            return false;
        }
        workspace.retravel(next.instanceId(), TravelSegment.of(in.getDurationMinutes(), accessType));
        return true;
    }

    /**
     * Moves the remote placements that follow each other from {@code first} on to
     * {@code location} and recommits them back to front, so each travel-out is measured
     * against what actually follows it. A null location means the user is somewhere unknown.
     */
    private boolean relocateRemoteRun(ScheduleWorkspace workspace, Placement first, Place location) {
        if (Objects.equals(first.getLocation(), location)) {
            return true;
        }
        List<Placement> run = new ArrayList<>();
        for (Optional<Placement> cursor = Optional.of(first);
             cursor.isPresent() && isRemote(cursor.get());
             cursor = directlyAfter(workspace, cursor.get())) {
            run.add(cursor.get());
        }
        for (Placement remote : run) {
            workspace.withdraw(remote.instanceId());
        }
        for (int i = run.size() - 1; i >= 0; i--) {
            Placement remote = run.get(i);
            FreeInterval around = workspace.freeIntervalAt(remote.getStartMinute())
                    .orElseThrow(() -> new IllegalStateException("withdrawn range not free: " + remote.instanceId()));
            AccessType nextAccess = nextAccessType(around, remote.getInstance(), workspace.state());
            TravelEstimate out = legs.leg(
                    location, location == null, around.getNext(), around.isNextOpaque(), nextAccess, remote.getEndMinute());
            if (!out.isFeasible() || remote.getEndMinute() + out.getDurationMinutes() > around.getEndMinute()) {
                log.debug("Refresh: {} can no longer reach what follows it from its new place", remote.instanceId());
                return false;
            }
            workspace.commit(remote.toBuilder()
                    .location(location)
                    .travelIn(TravelSegment.none())
                    .travelOut(TravelSegment.of(out.getDurationMinutes(), nextAccess))
                    .build());
        }
        return true;
    }

    /**
     * Placement that follows {@code placement} on the same day with no calendar event between.
     */
    private static Optional<Placement> directlyAfter(ScheduleWorkspace workspace, Placement placement) {
        Optional<Placement> following = workspace.state().startingAt(placement.getEndMinute());
        if (following.isEmpty()) {
            following = workspace.directSuccessor(placement.getEndMinute());
        }
        long day = TimeUtils.dayIndex(placement.getStartMinute());
        return following.filter(next -> TimeUtils.dayIndex(next.getStartMinute()) == day);
    }

    private static boolean isRemote(Placement placement) {
        return placement.getInstance().getDefinition().getLocation().getKind() == LocationKind.REMOTE;
    }

    /**
     * Returns the dates an instance may land on given the current timeline.
     */
    DateScreen screenDates(ErrandInstance instance, ScheduleState state) {
        ErrandDefinition definition = instance.getDefinition();
        RepetitionRule rule = definition.getRepetition();
        int minimumGap = Math.max(1, definition.getIntervalRange().effectiveMinimumGapDays());
        List<LocalDate> siblingDates = new ArrayList<>();
        for (Placement sibling : state.placementsOf(definition.getId())) {
            siblingDates.add(horizon.dateOfMinute(sibling.getStartMinute()));
        }

        List<LocalDate> allowed = new ArrayList<>();
        for (LocalDate date = instance.getEarliestDate(); !date.isAfter(instance.getLatestDate()); date = date.plusDays(1)) {
            if (!rule.getKind().usesAllowedDays() || allowedDay(rule, date)) {
                allowed.add(date);
            }
        }
        if (allowed.isEmpty()) {
            return new DateScreen(List.of(), BlockingReason.TIME_WINDOW_CONFLICT);
        }

        List<LocalDate> spaced = new ArrayList<>();
        for (LocalDate date : allowed) {
            if (respectsGap(date, siblingDates, minimumGap)) {
                spaced.add(date);
            }
        }
        if (spaced.isEmpty()) {
            return new DateScreen(List.of(), BlockingReason.INTERVAL_SPACING_CONFLICT);
        }

        List<LocalDate> clear = new ArrayList<>();
        for (LocalDate date : spaced) {
            if (!hasConflictingErrand(definition, date, state)) {
                clear.add(date);
            }
        }
        if (clear.isEmpty()) {
            return new DateScreen(List.of(), BlockingReason.CONFLICTING_ERRAND);
        }

        Set<LocalDate> partnerDates = new HashSet<>();
        for (Placement placed : state.placementsBetween(
                horizon.minuteAt(instance.getEarliestDate(), 0),
                horizon.minuteAt(instance.getLatestDate(), 0) + TimeUtils.MINUTES_PER_DAY)) {
            ErrandDefinition other = placed.getInstance().getDefinition();
            if (complements(definition, other) && (definition.isSameDayRequired() || other.isSameDayRequired())) {
                partnerDates.add(horizon.dateOfMinute(placed.getStartMinute()));
            }
        }
        if (partnerDates.isEmpty()) {
            return new DateScreen(clear, null);
        }
        List<LocalDate> paired = new ArrayList<>();
        for (LocalDate date : clear) {
            if (partnerDates.contains(date)) {
                paired.add(date);
            }
        }
        if (paired.isEmpty()) {
            return new DateScreen(List.of(), BlockingReason.COMPLEMENTARY_REQUIREMENT);
        }
        return new DateScreen(paired, null);
    }

    private Outcome search(ErrandInstance instance, List<LocalDate> dates, int durationMinutes, ScheduleWorkspace workspace) {
        List<Supplier<Evaluation>> tasks = new ArrayList<>();
        for (LocalDate date : dates) {
            DaySlot slot = daySlot(instance.getDefinition(), date, workspace.state());
            if (slot.windowStart() >= slot.windowEnd()) {
                continue;
            }
            List<FreeInterval> intervals = workspace.ledger().intervalsIntersecting(slot.windowStart(), slot.windowEnd());
            int bound = Math.min(intervals.size(), maxCandidateIntervals);
            for (int i = 0; i < bound; i++) {
                FreeInterval interval = intervals.get(i);
                AccessType nextAccess = nextAccessType(interval, instance, workspace.state());
                tasks.add(() -> evaluate(instance, interval, slot, durationMinutes, nextAccess));
            }
        }

        Fit best = null;
        boolean travelBlocked = false;
        for (Evaluation evaluation : run(tasks)) {
            travelBlocked |= evaluation.travelBlocked();
            if (evaluation.fit() != null && (best == null || FIT_ORDER.compare(evaluation.fit(), best) < 0)) {
                best = evaluation.fit();
            }
        }
        return new Outcome(best, travelBlocked);
    }

    /**
     * Window of one date, narrowed and annotated by the complementary errands already on it.
     */
    private DaySlot daySlot(ErrandDefinition definition, LocalDate date, ScheduleState state) {
        TimeWindow window = definition.getValidWindow();
        long windowStart = horizon.minuteAt(date, window.getStartMinute());
        long windowEnd = horizon.minuteAt(date, window.getEndMinute());
        long dayStart = horizon.minuteAt(date, 0);
        Set<Place> partnerPlaces = new HashSet<>();
        for (Placement placed : state.placementsBetween(dayStart, dayStart + TimeUtils.MINUTES_PER_DAY)) {
            ErrandDefinition other = placed.getInstance().getDefinition();
            if (!complements(definition, other)) {
                continue;
            }
            if (definition.isOrderRequired()) {
                windowStart = Math.max(windowStart, placed.getEndMinute());
            }
            if ((definition.isSameLocationRequired() || other.isSameLocationRequired()) && placed.getLocation() != null) {
                partnerPlaces.add(placed.getLocation());
            }
        }
        return new DaySlot(windowStart, windowEnd, partnerPlaces);
    }

    private List<Evaluation> run(List<Supplier<Evaluation>> tasks) {
        List<Evaluation> results = new ArrayList<>(tasks.size());
        if (executor == null || tasks.size() < 2) {
            for (Supplier<Evaluation> task : tasks) {
                results.add(task.get());
            }
            return results;
        }
        List<CompletableFuture<Evaluation>> futures = new ArrayList<>(tasks.size());
        for (Supplier<Evaluation> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(task, executor));
        }
        for (CompletableFuture<Evaluation> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException ex) {
                if (ex.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw ex;
            }
        }
        return results;
    }

    private Evaluation evaluate(
            ErrandInstance instance,
            FreeInterval interval,
            DaySlot slot,
            int durationMinutes,
            AccessType nextAccess
    ) {
        long usableStart = Math.max(interval.getStartMinute(), slot.windowStart());
        long usableEnd = Math.min(interval.getEndMinute(), slot.windowEnd());
        if (usableEnd - usableStart < durationMinutes) {
            return Evaluation.TIME_MISFIT;
        }

        LocationSpec location = instance.getDefinition().getLocation();
        return switch (location.getKind()) {
            case REMOTE -> evaluateRemote(instance, interval, slot, durationMinutes, usableStart, nextAccess);
            case EXACT_COORDINATE, NAMED_PLACE -> toEvaluation(evaluateDestination(
                    instance, interval, slot, durationMinutes, location.getPlace(), nextAccess));
            case STORE_CATEGORY -> evaluateOpen(instance, interval, slot, durationMinutes, usableEnd, nextAccess);
        };
    }

    private Evaluation evaluateRemote(
            ErrandInstance instance,
            FreeInterval interval,
            DaySlot slot,
            int durationMinutes,
            long start,
            AccessType nextAccess
    ) {
        Place location = interval.isOriginOpaque() ? null : interval.getOrigin();
        long end = start + durationMinutes;
        TravelEstimate out = legs.leg(
                location, interval.isOriginOpaque(), interval.getNext(), interval.isNextOpaque(), nextAccess, end);
        if (!out.isFeasible() || end + out.getDurationMinutes() > interval.getEndMinute() || end > slot.windowEnd()) {
            return Evaluation.TRAVEL_BLOCKED;
        }
        Placement placement = Placement.builder()
                .instance(instance)
                .startMinute(start)
                .endMinute(end)
                .location(location)
                .travelOut(TravelSegment.of(out.getDurationMinutes(), nextAccess))
                .build();
        return new Evaluation(new Fit(placement, slot.mismatch(location), out.getDurationMinutes(), 0, 0, ""), false);
    }

    private Evaluation evaluateOpen(
            ErrandInstance instance,
            FreeInterval interval,
            DaySlot slot,
            int durationMinutes,
            long usableEnd,
            AccessType nextAccess
    ) {
        LocationSpec location = instance.getDefinition().getLocation();
        Place searchOrigin = interval.isOriginOpaque() ? legs.home() : interval.getOrigin();
        // Travel may start at the interval start even when the window opens later.
        int budget = (int) Math.min(Integer.MAX_VALUE, usableEnd - interval.getStartMinute() - durationMinutes);
        List<LocationCandidate> candidates = legs.gateway().candidates(location, searchOrigin, budget);
        Fit best = null;
        for (LocationCandidate candidate : candidates) {
            Fit fit = evaluateDestination(instance, interval, slot, durationMinutes, candidate.getPlace(), nextAccess);
            if (fit != null && (best == null || FIT_ORDER.compare(fit, best) < 0)) {
                best = fit;
            }
        }
        return toEvaluation(best);
    }

    /**
     * Fits the errand at a concrete destination inside one interval, or returns null when
     * travel makes it infeasible.
     */
    private Fit evaluateDestination(
            ErrandInstance instance,
            FreeInterval interval,
            DaySlot slot,
            int durationMinutes,
            Place destination,
            AccessType nextAccess
    ) {
        AccessType accessType = instance.getDefinition().getAccessType();
        TravelEstimate in = legs.leg(
                interval.getOrigin(), interval.isOriginOpaque(), destination, false,
                accessType, interval.getStartMinute());
        if (!in.isFeasible()) {
            return null;
        }
        long start = Math.max(interval.getStartMinute() + in.getDurationMinutes(), slot.windowStart());
        long end = start + durationMinutes;
        if (end > slot.windowEnd() || end > interval.getEndMinute()) {
            return null;
        }
        TravelEstimate out = legs.leg(
                destination, false, interval.getNext(), interval.isNextOpaque(), nextAccess, end);
        if (!out.isFeasible() || end + out.getDurationMinutes() > interval.getEndMinute()) {
            return null;
        }
        int transfers = accessType.isTransit() ? in.getTransfers() : 0;
        Placement placement = Placement.builder()
                .instance(instance)
                .startMinute(start)
                .endMinute(end)
                .location(destination)
                .travelIn(TravelSegment.of(in.getDurationMinutes(), accessType))
                .travelOut(TravelSegment.of(out.getDurationMinutes(), nextAccess))
                .build();
        return new Fit(
                placement,
                slot.mismatch(destination),
                (long) in.getDurationMinutes() + out.getDurationMinutes(),
                Math.max(0, transfers - 1),
                transfers,
                destination.getLabel()
        );
    }

    private static Evaluation toEvaluation(Fit fit) {
        return fit == null ? Evaluation.TRAVEL_BLOCKED : new Evaluation(fit, false);
    }

    /**
     * Leg into a directly following placement uses that errand's access type.
     */
    private static AccessType nextAccessType(FreeInterval interval, ErrandInstance instance, ScheduleState state) {
        if (!interval.isEndOfDay() && !interval.isNextOpaque()) {
            return state.startingAt(interval.getEndMinute())
                    .map(next -> next.getInstance().getDefinition().getAccessType())
                    .orElse(instance.getDefinition().getAccessType());
        }
        return instance.getDefinition().getAccessType();
    }

    private static boolean allowedDay(RepetitionRule rule, LocalDate date) {
        return switch (rule.getKind()) {
            case WEEKLY_ON_DAYS -> rule.getDaysOfWeek().contains(date.getDayOfWeek());
            case MONTHLY_ON_DAYS -> rule.getDaysOfMonth().contains(date.getDayOfMonth())
                    || (date.getDayOfMonth() == date.lengthOfMonth()
                    && rule.getDaysOfMonth().stream().anyMatch(day -> day > date.getDayOfMonth()));
            case YEARLY_ON_DAYS -> rule.getMonthDays().stream()
                    .anyMatch(monthDay -> monthDay.atYear(date.getYear()).equals(date));
            default -> true;
        };
    }

    private static boolean respectsGap(LocalDate date, List<LocalDate> siblingDates, int minimumGap) {
        for (LocalDate sibling : siblingDates) {
            if (Math.abs(ChronoUnit.DAYS.between(sibling, date)) < minimumGap) {
                return false;
            }
        }
        return true;
    }

    private static boolean complements(ErrandDefinition definition, ErrandDefinition other) {
        return definition.getComplementaryDefinitionIds().contains(other.getId())
                || other.getComplementaryDefinitionIds().contains(definition.getId());
    }

    private boolean hasConflictingErrand(ErrandDefinition definition, LocalDate date, ScheduleState state) {
        long dayStart = horizon.minuteAt(date, 0);
        for (Placement placed : state.placementsBetween(dayStart, dayStart + TimeUtils.MINUTES_PER_DAY)) {
            ErrandDefinition other = placed.getInstance().getDefinition();
            if (definition.getConflictingDefinitionIds().contains(other.getId())
                    || other.getConflictingDefinitionIds().contains(definition.getId())) {
                return true;
            }
        }
        return false;
    }

    record DateScreen(List<LocalDate> dates, BlockingReason reason) {
    }

    private record Outcome(Fit best, boolean travelBlocked) {
    }

    private record Fit(
            Placement placement,
            int locationMismatch,
            long addedTravel,
            int excessTransfers,
            int transfers,
            String label
    ) {
    }

    /**
     * Effective window of one date; {@code partnerPlaces} holds where same-location partners
     * already happen that day.
     */
    private record DaySlot(long windowStart, long windowEnd, Set<Place> partnerPlaces) {
        int mismatch(Place place) {
            return partnerPlaces.isEmpty() || partnerPlaces.contains(place) ? 0 : 1;
        }
    }

    private record Evaluation(Fit fit, boolean travelBlocked) {
        static final Evaluation TIME_MISFIT = new Evaluation(null, false);
        static final Evaluation TRAVEL_BLOCKED = new Evaluation(null, true);
    }
}
