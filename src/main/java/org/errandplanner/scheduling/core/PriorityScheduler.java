package org.errandplanner.scheduling.core;

import io.github.resilience4j.retry.Retry;
import org.errandplanner.scheduling.ledger.FreeTimeLedger;
import org.errandplanner.scheduling.model.BusyEvent;
import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.ErrandInstance;
import org.errandplanner.scheduling.model.InstanceStatus;
import org.errandplanner.scheduling.model.PinnedErrand;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.Placement;
import org.errandplanner.scheduling.model.PlanningHorizon;
import org.errandplanner.scheduling.recurrence.InvalidRecurrenceException;
import org.errandplanner.scheduling.recurrence.RecurrenceExpander;
import org.errandplanner.scheduling.recurrence.RecurrenceSequence;
import org.errandplanner.scheduling.state.ScheduleState;
import org.errandplanner.scheduling.state.ScheduleWorkspace;
import org.errandplanner.scheduling.state.WorkspaceConflictException;
import org.errandplanner.scheduling.travel.CalendarProvider;
import org.errandplanner.scheduling.travel.LocationResolver;
import org.errandplanner.scheduling.travel.ProviderException;
import org.errandplanner.scheduling.travel.ProviderRetry;
import org.errandplanner.scheduling.travel.TravelGateway;
import org.errandplanner.scheduling.travel.TravelTimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Driver loop of one planning pass.
 *
 * <p>Pass flow:</p>
 * <ul>
 * <li>Fetch busy events (retried through {@link ProviderRetry}) and build the ledger and workspace.</li>
 * <li>Validate definitions, commit pinned occurrences, expand the rest into sequences.</li>
 * <li>Drain a priority queue: highest tier first, then earliest window start, shortest
 *     duration, definition id and target date.</li>
 * <li>Place each instance directly, or through the cascade resolver, or report it
 *     unschedulable; feed the outcome back to its sequence.</li>
 * </ul>
 *
 * <p>The calendar revision is re-read before every instance; a change cancels the pass
 * with {@link PlanningCancelledException} and nothing from it is returned.</p>
 */
public final class PriorityScheduler {
    private static final Logger log = LoggerFactory.getLogger(PriorityScheduler.class);

    public static final String REASON_CALENDAR_UNAVAILABLE = "PS_CALENDAR_UNAVAILABLE";
    public static final String REASON_PINNED_UNKNOWN_DEFINITION = "PS_PINNED_UNKNOWN_DEFINITION";
    public static final String REASON_PINNED_NOT_FREE = "PS_PINNED_NOT_FREE";
    public static final String REASON_PINNED_INVALID = "PS_PINNED_INVALID";

    static final String MDC_PLANNING_PASS = "planningPass";
    static final String MDC_INSTANCE_ID = "instanceId";

    static final Comparator<ErrandInstance> PROCESSING_ORDER = Comparator
            .comparingInt((ErrandInstance instance) -> instance.priority()).reversed()
            .thenComparingInt(instance -> instance.getDefinition().getValidWindow().getStartMinute())
            .thenComparingInt(instance -> instance.getDefinition().getEstimatedDurationMinutes())
            .thenComparing(ErrandInstance::definitionId)
            .thenComparing(ErrandInstance::getTargetDate);

    private static final AtomicLong PASS_SEQUENCE = new AtomicLong();

    private final Place home;
    private final TravelTimeProvider travelTimeProvider;
    private final LocationResolver locationResolver;
    private final SchedulerConfig config;
    private final Executor executor;
    private final Retry calendarRetry;
    private final DefinitionValidator validator = new DefinitionValidator();
    private final RecurrenceExpander expander = new RecurrenceExpander();

    /**
     * Creates a scheduler.
     *
     * @param home where each day starts.
     * @param travelTimeProvider directions collaborator.
     * @param locationResolver places collaborator (nullable when no open locations are planned).
     * @param config bounds and tuning.
     * @param executor optional executor for provider lookups.
     */
    public PriorityScheduler(
            Place home,
            TravelTimeProvider travelTimeProvider,
            LocationResolver locationResolver,
            SchedulerConfig config,
            Executor executor
    ) {
        this.home = Objects.requireNonNull(home, "home");
        this.travelTimeProvider = Objects.requireNonNull(travelTimeProvider, "travelTimeProvider");
        this.locationResolver = locationResolver;
        this.config = Objects.requireNonNull(config, "config");
        this.executor = executor;
        this.calendarRetry = ProviderRetry.named(
                ProviderRetry.registry(config.getProviderMaxAttempts(), config.getProviderBackoffMillis()),
                "calendar"
        );
    }

    /**
     * Runs one pass.
     *
     * @throws PlanningCancelledException when the calendar changed while the pass ran.
     * @throws SchedulingException when the calendar could not be read.
     */
    public SchedulingResult run(
            List<ErrandDefinition> definitions,
            PlanningHorizon horizon,
            CalendarProvider calendar,
            List<PinnedErrand> pinned
    ) {
        Objects.requireNonNull(definitions, "definitions");
        Objects.requireNonNull(horizon, "horizon");
        Objects.requireNonNull(calendar, "calendar");
        Objects.requireNonNull(pinned, "pinned");

        String passId = Long.toString(PASS_SEQUENCE.incrementAndGet());
        MDC.put(MDC_PLANNING_PASS, passId);
        try {
            return new Pass(definitions, horizon, calendar, pinned).execute();
        } finally {
            MDC.remove(MDC_INSTANCE_ID);
            MDC.remove(MDC_PLANNING_PASS);
        }
    }

    private List<BusyEvent> fetchBusyEvents(CalendarProvider calendar, PlanningHorizon horizon) {
        try {
            return Retry.decorateSupplier(
                    calendarRetry,
                    () -> List.copyOf(Objects.requireNonNull(calendar.busyEvents(horizon), "busy events"))
            ).get();
        } catch (ProviderException ex) {
            throw new SchedulingException(
                    REASON_CALENDAR_UNAVAILABLE,
                    "calendar unavailable after " + config.getProviderMaxAttempts() + " attempts: " + ex.getMessage(),
                    ex
            );
        }
    }

    /**
     * Mutable state of one pass; discarded wholesale on cancellation.
     */
    private final class Pass {
        private final List<ErrandDefinition> definitions;
        private final PlanningHorizon horizon;
        private final CalendarProvider calendar;
        private final List<PinnedErrand> pinned;

        private final List<RejectedDefinition> rejected = new ArrayList<>();
        private final List<UnschedulableErrand> unschedulable = new ArrayList<>();
        private final Map<String, InstanceStatus> statuses = new HashMap<>();
        private final PriorityQueue<ErrandInstance> queue = new PriorityQueue<>(PROCESSING_ORDER);
        private final Map<String, RecurrenceSequence> sequences = new TreeMap<>();

        private int processed;
        private int directPlacements;
        private int cascadeAttempts;
        private int cascadePlacements;

        Pass(List<ErrandDefinition> definitions, PlanningHorizon horizon, CalendarProvider calendar, List<PinnedErrand> pinned) {
            this.definitions = definitions;
            this.horizon = horizon;
            this.calendar = calendar;
            this.pinned = pinned;
        }

        SchedulingResult execute() {
            long revision = calendar.revision();
            List<BusyEvent> busyEvents = fetchBusyEvents(calendar, horizon);
            ScheduleWorkspace workspace = new ScheduleWorkspace(new FreeTimeLedger(horizon, home, busyEvents));
            TravelGateway gateway = new TravelGateway(
                    travelTimeProvider,
                    locationResolver,
                    config.getProviderMaxAttempts(),
                    config.getProviderBackoffMillis()
            );
            PlacementSearch search = new PlacementSearch(gateway, horizon, home, config, executor);
            CascadeResolver cascade = new CascadeResolver(search, horizon, config);

            Map<String, ErrandDefinition> accepted = validateDefinitions();
            Map<String, List<LocalDate>> priors = commitPinned(accepted, workspace);
            expand(accepted, priors);
            log.info("Pass started: {} definitions accepted, {} rejected, {} busy events, horizon {} + {} days",
                    accepted.size(), rejected.size(), busyEvents.size(), horizon.getStartDate(), horizon.getDays());

            while (!queue.isEmpty()) {
                ErrandInstance instance = queue.poll();
                if (calendar.revision() != revision) {
                    throw new PlanningCancelledException("calendar changed during pass (revision "
                            + revision + " -> " + calendar.revision() + ")");
                }
                MDC.put(MDC_INSTANCE_ID, instance.getId());
                try {
                    process(instance, workspace, search, cascade);
                } finally {
                    MDC.remove(MDC_INSTANCE_ID);
                }
                enqueueReady(sequences.get(instance.definitionId()));
            }

            SchedulingResult.SchedulingResultBuilder result = SchedulingResult.builder()
                    .rejectedDefinitions(rejected)
                    .unschedulable(unschedulable);
            for (Placement placement : workspace.state().placements()) {
                result.placedErrand(toScheduled(placement));
            }
            result.telemetry(PlanningTelemetry.builder()
                    .instancesProcessed(processed)
                    .directPlacements(directPlacements)
                    .cascadeAttempts(cascadeAttempts)
                    .cascadePlacements(cascadePlacements)
                    .providerCalls(gateway.providerCalls())
                    .providerFailures(gateway.providerFailures())
                    .exhaustedProviderQueries(gateway.exhaustedQueries())
                    .build());
            log.info("Pass finished: {} placed, {} unschedulable, {} cascades ({} successful)",
                    workspace.state().size(), unschedulable.size(), cascadeAttempts, cascadePlacements);
            return result.build();
        }

        private void process(ErrandInstance instance, ScheduleWorkspace workspace, PlacementSearch search, CascadeResolver cascade) {
            processed++;
            statuses.put(instance.getId(), InstanceStatus.UNSCHEDULED);
            RecurrenceSequence sequence = sequences.get(instance.definitionId());

            PlacementResult direct = search.place(instance, workspace);
            if (direct.isScheduled()) {
                workspace.commit(direct.getPlacement());
                transition(instance, InstanceStatus.PLACED);
                directPlacements++;
                sequence.confirm(instance, horizon.dateOfMinute(direct.getPlacement().getStartMinute()));
                log.debug("Placed {} directly", instance.getId());
                return;
            }

            transition(instance, InstanceStatus.TENTATIVELY_DISPLACING);
            cascadeAttempts++;
            ScheduleState before = workspace.state();
            CascadeResult cascaded = cascade.resolve(instance, workspace, direct.getBlockingReason());
            if (cascaded.isPlaced()) {
                transition(instance, InstanceStatus.PLACED);
                cascadePlacements++;
                sequence.confirm(instance, horizon.dateOfMinute(cascaded.getPlacement().getStartMinute()));
                reanchorDisplaced(cascaded.getDisplacedInstanceIds(), before, workspace.state());
                return;
            }
            transition(instance, InstanceStatus.UNSCHEDULABLE);
            unschedulable.add(new UnschedulableErrand(instance, cascaded.getBlockingReason()));
            sequence.skip(instance);
            log.info("Unschedulable {}: {}", instance.getId(), cascaded.getBlockingReason());
        }

        /**
         * Tells each displaced neighbour's sequence where it landed. A sequence whose next
         * target moved drops its pending instance, which is re-queued from the new anchor.
         */
        private void reanchorDisplaced(List<String> displacedIds, ScheduleState before, ScheduleState after) {
            for (String instanceId : displacedIds) {
                Placement from = before.get(instanceId)
                        .orElseThrow(() -> new IllegalStateException("displaced " + instanceId + " was not placed"));
                Placement to = after.get(instanceId)
                        .orElseThrow(() -> new IllegalStateException("displaced " + instanceId + " vanished"));
                RecurrenceSequence owner = sequences.get(from.definitionId());
                if (owner == null) {
                    continue;
                }
                LocalDate fromDate = horizon.dateOfMinute(from.getStartMinute());
                LocalDate toDate = horizon.dateOfMinute(to.getStartMinute());
                if (owner.relocate(from.getInstance(), fromDate, toDate)) {
                    queue.removeIf(pending -> pending.definitionId().equals(from.definitionId()));
                    log.debug("Re-anchored {} after {} moved {} -> {}", from.definitionId(), instanceId, fromDate, toDate);
                    enqueueReady(owner);
                }
            }
        }

        private void transition(ErrandInstance instance, InstanceStatus next) {
            InstanceStatus current = statuses.get(instance.getId());
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("illegal status change " + current + " -> " + next
                        + " for " + instance.getId());
            }
            statuses.put(instance.getId(), next);
        }

        private Map<String, ErrandDefinition> validateDefinitions() {
            Map<String, ErrandDefinition> accepted = new TreeMap<>();
            for (ErrandDefinition definition : definitions) {
                try {
                    validator.validate(definition);
                    if (accepted.containsKey(definition.getId())) {
                        throw new ErrandValidationException(
                                definition.getId(),
                                DefinitionValidator.REASON_DUPLICATE_ID,
                                "definition id " + definition.getId() + " appears more than once"
                        );
                    }
                    accepted.put(definition.getId(), definition);
                } catch (ErrandValidationException ex) {
                    log.warn("Rejected definition {}: {}", ex.getDefinitionId(), ex.getMessage());
                    rejected.add(new RejectedDefinition(ex.getDefinitionId(), ex.getReasonCode(), ex.getMessage()));
                }
            }
            return accepted;
        }

        private Map<String, List<LocalDate>> commitPinned(Map<String, ErrandDefinition> accepted, ScheduleWorkspace workspace) {
            Map<String, List<LocalDate>> priors = new HashMap<>();
            List<PinnedErrand> ordered = new ArrayList<>(pinned);
            ordered.sort(Comparator.comparing(PinnedErrand::getStart).thenComparing(PinnedErrand::getDefinitionId));
            for (PinnedErrand occurrence : ordered) {
                ErrandDefinition definition = accepted.get(occurrence.getDefinitionId());
                if (definition == null) {
                    reject(occurrence, REASON_PINNED_UNKNOWN_DEFINITION,
                            "pinned occurrence refers to unknown or rejected definition");
                    continue;
                }
                if (occurrence.getStart() == null || occurrence.getDurationMinutes() <= 0) {
                    reject(occurrence, REASON_PINNED_INVALID, "pinned occurrence needs a start and a positive duration");
                    continue;
                }
                LocalDate date = occurrence.getStart().toLocalDate();
                priors.computeIfAbsent(definition.getId(), ignored -> new ArrayList<>()).add(date);
                if (!horizon.contains(date)) {
                    continue;
                }
                long start = horizon.toMinute(occurrence.getStart());
                Placement placement = Placement.builder()
                        .instance(ErrandInstance.onDate(definition, date))
                        .startMinute(start)
                        .endMinute(start + occurrence.getDurationMinutes())
                        .location(occurrence.getLocation())
                        .pinned(true)
                        .build();
                try {
                    workspace.commit(placement);
                } catch (WorkspaceConflictException ex) {
                    priors.get(definition.getId()).remove(date);
                    reject(occurrence, REASON_PINNED_NOT_FREE, ex.getMessage());
                }
            }
            return priors;
        }

        private void reject(PinnedErrand occurrence, String reasonCode, String message) {
            log.warn("Rejected pinned occurrence {} at {}: {}", occurrence.getDefinitionId(), occurrence.getStart(), message);
            rejected.add(new RejectedDefinition(occurrence.getDefinitionId(), reasonCode, message));
        }

        private void expand(Map<String, ErrandDefinition> accepted, Map<String, List<LocalDate>> priors) {
            for (ErrandDefinition definition : accepted.values()) {
                try {
                    RecurrenceSequence sequence = expander.expand(
                            definition, horizon, priors.getOrDefault(definition.getId(), List.of()));
                    sequences.put(definition.getId(), sequence);
                    enqueueReady(sequence);
                } catch (InvalidRecurrenceException ex) {
                    log.warn("Rejected definition {}: {}", definition.getId(), ex.getMessage());
                    rejected.add(new RejectedDefinition(definition.getId(), ex.getReasonCode(), ex.getMessage()));
                }
            }
        }

        private void enqueueReady(RecurrenceSequence sequence) {
            if (sequence == null) {
                return;
            }
            for (Optional<ErrandInstance> next = sequence.next(); next.isPresent(); next = sequence.next()) {
                queue.add(next.get());
            }
        }

        private ScheduledErrand toScheduled(Placement placement) {
            return ScheduledErrand.builder()
                    .instanceId(placement.instanceId())
                    .definitionId(placement.definitionId())
                    .title(placement.getInstance().getDefinition().getTitle())
                    .start(horizon.toDateTime(placement.getStartMinute()))
                    .end(horizon.toDateTime(placement.getEndMinute()))
                    .location(placement.getLocation())
                    .travel(placement.getTravelIn())
                    .pinned(placement.isPinned())
                    .build();
        }
    }
}
