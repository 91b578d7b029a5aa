package org.errandplanner.scheduling.core;

import org.errandplanner.core.time.TimeUtils;
import org.errandplanner.scheduling.model.BlockingReason;
import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.ErrandInstance;
import org.errandplanner.scheduling.model.Placement;
import org.errandplanner.scheduling.model.PlanningHorizon;
import org.errandplanner.scheduling.model.TimeWindow;
import org.errandplanner.scheduling.state.ScheduleState;
import org.errandplanner.scheduling.state.ScheduleWorkspace;
import org.errandplanner.scheduling.state.WorkspaceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bounded-depth displacement search for instances that found no free slot.
 *
 * <p>Each attempt works on forks of the live workspace:</p>
 * <ul>
 * <li>Withdraw one displaceable neighbour, place the blocked instance, re-place the neighbour.</li>
 * <li>When the neighbour finds no slot, recurse with one less hop and the neighbour's
 *     priority as the ceiling for what it may displace.</li>
 * <li>Pinned instances, instances of higher priority and instances already moved in the
 *     current chain are never displaced.</li>
 * </ul>
 *
 * <p>The shortest successful chain wins (ties broken by displaced instance ids) and is
 * adopted atomically; when none succeeds every fork is dropped and the live workspace is
 * exactly as it was.</p>
 */
public final class CascadeResolver {
    private static final Logger log = LoggerFactory.getLogger(CascadeResolver.class);

    private static final Comparator<Chain> CHAIN_ORDER = Comparator
            .comparingInt((Chain chain) -> chain.displaced().size())
            .thenComparing(Chain::displaced, CascadeResolver::compareIds);

    private final PlacementSearch search;
    private final PlanningHorizon horizon;
    private final int depthBudget;
    private final int maxNeighbors;

    public CascadeResolver(PlacementSearch search, PlanningHorizon horizon, SchedulerConfig config) {
        this.search = Objects.requireNonNull(search, "search");
        this.horizon = Objects.requireNonNull(horizon, "horizon");
        Objects.requireNonNull(config, "config");
        this.depthBudget = config.getCascadeDepth();
        this.maxNeighbors = config.getMaxCascadeNeighbors();
    }

    /**
     * Resolves with the configured depth budget.
     */
    public CascadeResult resolve(ErrandInstance instance, ScheduleWorkspace workspace, BlockingReason initialReason) {
        return resolve(instance, workspace, initialReason, depthBudget);
    }

    /**
     * Attempts to place {@code instance} by moving committed neighbours.
     *
     * @param instance instance whose direct search failed.
     * @param workspace live workspace; changed only when a chain succeeds.
     * @param initialReason blocking reason of the failed direct search, reported on exhaustion.
     * @param depth maximum number of displacement hops.
     * @return placed result with the displacement chain, or the initial reason.
     */
    public CascadeResult resolve(
            ErrandInstance instance,
            ScheduleWorkspace workspace,
            BlockingReason initialReason,
            int depth
    ) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(initialReason, "initialReason");

        Chain best = explore(instance, workspace, instance.priority(), depth, Set.of(instance.getId()));
        if (best == null) {
            log.debug("Cascade: no displacement chain within depth {} for {}", depth, instance.getId());
            return CascadeResult.stillUnschedulable(initialReason);
        }
        workspace.adopt(best.workspace());
        Placement placement = workspace.state().get(instance.getId())
                .orElseThrow(() -> new IllegalStateException("adopted chain lost " + instance.getId()));
        log.info("Cascade: placed {} by displacing {}", instance.getId(), best.displaced());
        return CascadeResult.placed(placement, best.displaced());
    }

    private Chain explore(
            ErrandInstance target,
            ScheduleWorkspace base,
            int ceilingPriority,
            int depth,
            Set<String> protectedIds
    ) {
        if (depth <= 0) {
            return null;
        }
        Chain best = null;
        for (Placement neighbour : displaceableNeighbours(target, base.state(), ceilingPriority, protectedIds)) {
            Chain chain = tryDisplace(target, base, neighbour, depth, protectedIds);
            if (chain != null && (best == null || CHAIN_ORDER.compare(chain, best) < 0)) {
                best = chain;
            }
        }
        return best;
    }

    private Chain tryDisplace(
            ErrandInstance target,
            ScheduleWorkspace base,
            Placement neighbour,
            int depth,
            Set<String> protectedIds
    ) {
        ScheduleWorkspace branch = base.fork();
        try {
            Placement withdrawn = branch.withdraw(neighbour.instanceId())
                    .orElseThrow(() -> new IllegalStateException("neighbour vanished: " + neighbour.instanceId()));
            if (!search.refreshTravelAfter(branch, withdrawn)) {
                return null;
            }
            PlacementResult targetResult = search.place(target, branch);
            if (!targetResult.isScheduled()) {
                return null;
            }
            branch.commit(targetResult.getPlacement());

            PlacementResult neighbourResult = search.place(neighbour.getInstance(), branch);
            if (neighbourResult.isScheduled()) {
                branch.commit(neighbourResult.getPlacement());
                return new Chain(branch, List.of(neighbour.instanceId()));
            }

            Set<String> chainIds = new HashSet<>(protectedIds);
            chainIds.add(target.getId());
            chainIds.add(neighbour.instanceId());
            Chain deeper = explore(neighbour.getInstance(), branch, neighbour.priority(), depth - 1, chainIds);
            if (deeper == null) {
                return null;
            }
            branch.adopt(deeper.workspace());
            List<String> displaced = new ArrayList<>(deeper.displaced().size() + 1);
            displaced.add(neighbour.instanceId());
            displaced.addAll(deeper.displaced());
            return new Chain(branch, displaced);
        } catch (WorkspaceConflictException ex) {
            log.debug("Cascade: branch displacing {} for {} abandoned: {}",
                    neighbour.instanceId(), target.getId(), ex.getMessage());
            return null;
        }
    }

    /**
     * Committed placements that may be moved to make room for {@code target}: those
     * overlapping or touching its window on a landing date, plus same-day instances of
     * conflicting definitions.
     */
    List<Placement> displaceableNeighbours(
            ErrandInstance target,
            ScheduleState state,
            int ceilingPriority,
            Set<String> protectedIds
    ) {
        ErrandDefinition definition = target.getDefinition();
        TimeWindow window = definition.getValidWindow();
        Map<String, Ranked> ranked = new LinkedHashMap<>();
        for (LocalDate date = target.getEarliestDate(); !date.isAfter(target.getLatestDate()); date = date.plusDays(1)) {
            long dayStart = horizon.minuteAt(date, 0);
            long windowStart = horizon.minuteAt(date, window.getStartMinute());
            long windowEnd = horizon.minuteAt(date, window.getEndMinute());
            for (Placement placed : state.placementsBetween(dayStart, dayStart + TimeUtils.MINUTES_PER_DAY)) {
                if (placed.isPinned()
                        || placed.priority() > ceilingPriority
                        || protectedIds.contains(placed.instanceId())) {
                    continue;
                }
                long occupiedFrom = placed.getStartMinute() - placed.getTravelIn().getDurationMinutes();
                long occupiedTo = placed.getEndMinute() + placed.getTravelOut().getDurationMinutes();
                long distance = Math.max(0L, Math.max(windowStart - occupiedTo, occupiedFrom - windowEnd));
                boolean touchesWindow = distance == 0L;
                if (touchesWindow || conflicts(definition, placed.getInstance().getDefinition())) {
                    Ranked candidate = new Ranked(placed, distance);
                    ranked.merge(placed.instanceId(), candidate,
                            (left, right) -> left.distance() <= right.distance() ? left : right);
                }
            }
        }
        List<Ranked> ordered = new ArrayList<>(ranked.values());
        ordered.sort(Comparator
                .comparingInt((Ranked entry) -> entry.placement().priority())
                .thenComparingLong(Ranked::distance)
                .thenComparing(entry -> entry.placement().instanceId()));

        List<Placement> neighbours = new ArrayList<>(Math.min(ordered.size(), maxNeighbors));
        for (int i = 0; i < ordered.size() && i < maxNeighbors; i++) {
            neighbours.add(ordered.get(i).placement());
        }
        return neighbours;
    }

    private static boolean conflicts(ErrandDefinition definition, ErrandDefinition other) {
        return definition.getConflictingDefinitionIds().contains(other.getId())
                || other.getConflictingDefinitionIds().contains(definition.getId());
    }

    private static int compareIds(List<String> left, List<String> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int cmp = left.get(i).compareTo(right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private record Chain(ScheduleWorkspace workspace, List<String> displaced) {
    }

    private record Ranked(Placement placement, long distance) {
    }
}
