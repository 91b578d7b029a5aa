package org.errandplanner.scheduling.ledger;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.errandplanner.core.time.TimeUtils;
import org.errandplanner.scheduling.model.BusyEvent;
import org.errandplanner.scheduling.model.Placement;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.PlanningHorizon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Derived view of free time over a planning horizon.
 *
 * <p>The ledger keeps a sorted list of blockers (calendar events and reserved placements)
 * and derives free intervals from it on demand. Contracts:</p>
 * <ul>
 * <li>Free time is split at midnight; every day starts at home.</li>
 * <li>Ignorable calendar events are dropped; unlocated ones block time opaquely.</li>
 * <li>{@link #reserve(Placement)} accepts only ranges that are entirely free.</li>
 * <li>{@link #fork()} returns an independent copy for speculative work.</li>
 * </ul>
 *
 * <p>This class is NOT thread-safe; writers are serialized by the owning workspace.</p>
 */
public final class FreeTimeLedger {
    private static final Comparator<Blocker> BLOCKER_ORDER = Comparator
            .comparingLong(Blocker::start)
            .thenComparingLong(Blocker::end)
            .thenComparing(blocker -> blocker.ownerId() == null ? "" : blocker.ownerId());

    private final PlanningHorizon horizon;
    private final Place home;
    private final ObjectArrayList<Blocker> blockers;
    private List<FreeInterval> cachedIntervals;

    /**
     * Creates a ledger from calendar events.
     *
     * @param horizon planning horizon.
     * @param home where each day starts and ends.
     * @param busyEvents calendar events (may extend beyond the horizon; they are clamped).
     */
    public FreeTimeLedger(PlanningHorizon horizon, Place home, List<BusyEvent> busyEvents) {
        this.horizon = Objects.requireNonNull(horizon, "horizon");
        this.home = Objects.requireNonNull(home, "home");
        this.blockers = new ObjectArrayList<>();
        for (BusyEvent event : Objects.requireNonNull(busyEvents, "busyEvents")) {
            addBusyEvent(Objects.requireNonNull(event, "busy event"));
        }
        blockers.sort(BLOCKER_ORDER);
    }

    private FreeTimeLedger(FreeTimeLedger source) {
        this.horizon = source.horizon;
        this.home = source.home;
        this.blockers = new ObjectArrayList<>(source.blockers);
        this.cachedIntervals = source.cachedIntervals;
    }

    public PlanningHorizon horizon() {
        return horizon;
    }

    public Place home() {
        return home;
    }

    /**
     * Returns an independent copy; changes to either side are invisible to the other.
     */
    public FreeTimeLedger fork() {
        return new FreeTimeLedger(this);
    }

    /**
     * Returns all free intervals in ascending order.
     */
    public List<FreeInterval> intervals() {
        if (cachedIntervals == null) {
            cachedIntervals = Collections.unmodifiableList(computeIntervals());
        }
        return cachedIntervals;
    }

    /**
     * Returns free intervals intersecting {@code [fromMinute, toMinute)}, in ascending order.
     */
    public List<FreeInterval> intervalsIntersecting(long fromMinute, long toMinute) {
        List<FreeInterval> all = intervals();
        int low = 0;
        int high = all.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (all.get(mid).getEndMinute() <= fromMinute) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        List<FreeInterval> result = new ArrayList<>();
        for (int i = low; i < all.size(); i++) {
            FreeInterval interval = all.get(i);
            if (interval.getStartMinute() >= toMinute) {
                break;
            }
            if (interval.intersects(fromMinute, toMinute)) {
                result.add(interval);
            }
        }
        return result;
    }

    /**
     * Marks the placement's range as consumed.
     *
     * @throws IllegalStateException when any part of the range is not free.
     */
    public void reserve(Placement placement) {
        Objects.requireNonNull(placement, "placement");
        long start = placement.getStartMinute();
        long end = placement.getEndMinute();
        if (start >= end) {
            throw new IllegalArgumentException("placement range must be non-empty: " + placement.instanceId());
        }
        if (!isFree(start, end)) {
            throw new IllegalStateException("range " + TimeUtils.formatHorizonMinute(start) + " - "
                    + TimeUtils.formatHorizonMinute(end) + " is not free for " + placement.instanceId());
        }
        for (Blocker blocker : blockers) {
            if (placement.instanceId().equals(blocker.ownerId())) {
                throw new IllegalStateException("instance already reserved: " + placement.instanceId());
            }
        }
        Place location = placement.getLocation();
        insertSorted(new Blocker(start, end, location, location == null, placement.instanceId()));
    }

    /**
     * Reverses a reservation.
     *
     * @return true when a reservation for the instance existed.
     */
    public boolean release(String instanceId) {
        Objects.requireNonNull(instanceId, "instanceId");
        for (int i = 0; i < blockers.size(); i++) {
            if (instanceId.equals(blockers.get(i).ownerId())) {
                blockers.remove(i);
                cachedIntervals = null;
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether {@code [start, end)} lies inside one free interval.
     */
    public boolean isFree(long start, long end) {
        for (FreeInterval interval : intervalsIntersecting(start, end)) {
            if (interval.getStartMinute() <= start && end <= interval.getEndMinute()) {
                return true;
            }
        }
        return false;
    }

    private void addBusyEvent(BusyEvent event) {
        if (event.isIgnorable()) {
            return;
        }
        long start = Math.max(0L, horizon.toMinute(event.getStart()));
        long end = Math.min(horizon.lengthMinutes(), horizon.toMinute(event.getEnd()));
        Place location = event.getLocation();
        // Multi-day events are split at midnight so each blocker belongs to one day.
        while (start < end) {
            long dayEnd = TimeUtils.dayEnd(TimeUtils.dayIndex(start));
            long pieceEnd = Math.min(end, dayEnd);
            blockers.add(new Blocker(start, pieceEnd, location, location == null, null));
            start = pieceEnd;
        }
    }

    private void insertSorted(Blocker blocker) {
        int index = Collections.binarySearch(blockers, blocker, BLOCKER_ORDER);
        blockers.add(index < 0 ? -index - 1 : index, blocker);
        cachedIntervals = null;
    }

    private List<FreeInterval> computeIntervals() {
        List<FreeInterval> result = new ArrayList<>();
        int cursorIndex = 0;
        for (int day = 0; day < horizon.getDays(); day++) {
            long cursor = TimeUtils.dayStart(day);
            long dayEnd = TimeUtils.dayEnd(day);
            Place origin = home;
            boolean originOpaque = false;

            while (cursorIndex < blockers.size() && blockers.get(cursorIndex).start() < dayEnd) {
                Blocker blocker = blockers.get(cursorIndex++);
                if (blocker.start() > cursor) {
                    result.add(new FreeInterval(
                            cursor, blocker.start(),
                            origin, originOpaque,
                            blocker.location(), blocker.opaque(),
                            false
                    ));
                }
                if (blocker.end() >= cursor) {
                    cursor = blocker.end();
                    origin = blocker.location();
                    originOpaque = blocker.opaque();
                }
            }
            if (cursor < dayEnd) {
                result.add(new FreeInterval(cursor, dayEnd, origin, originOpaque, null, false, true));
            }
        }
        return result;
    }

    /**
     * One occupied range; {@code ownerId} is the instance id for reserved placements.
     */
    private record Blocker(long start, long end, Place location, boolean opaque, String ownerId) {
    }
}
