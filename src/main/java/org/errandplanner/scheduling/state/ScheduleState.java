package org.errandplanner.scheduling.state;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.errandplanner.core.time.TimeUtils;
import org.errandplanner.scheduling.model.Placement;
import org.errandplanner.scheduling.model.TravelSegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Committed timeline of placements.
 *
 * <p>Storage layout:</p>
 * <ul>
 * <li>{@code arena}: placements addressed by integer handle; removed slots are nulled.</li>
 * <li>{@code order}: live handles sorted by start minute, then instance id.</li>
 * <li>{@code handles}: instance id to handle index.</li>
 * </ul>
 *
 * <p>{@link #fork()} is copy-on-write: both sides share storage until one of them mutates,
 * at which point the mutating side takes a private copy. A discarded fork therefore costs
 * nothing beyond the copies it made itself.</p>
 *
 * <p>Invariant checked on every insert: the new placement's travel-in fits after its
 * predecessor and its travel-out fits before its successor on the same day. The caller
 * then rewrites the successor's travel-in (see {@link #retravel}).</p>
 */
public final class ScheduleState {
    private static final int NO_HANDLE = -1;

    private Storage storage;
    private boolean ownsStorage;

    public ScheduleState() {
        this.storage = new Storage(new ObjectArrayList<>(), new IntArrayList(), newHandleIndex());
        this.ownsStorage = true;
    }

    private ScheduleState(Storage shared) {
        this.storage = shared;
        this.ownsStorage = false;
    }

    /**
     * Returns a speculative copy sharing storage until either side writes.
     */
    public ScheduleState fork() {
        ownsStorage = false;
        return new ScheduleState(storage);
    }

    public int size() {
        return storage.order.size();
    }

    public boolean contains(String instanceId) {
        return storage.handles.getInt(instanceId) != NO_HANDLE;
    }

    public Optional<Placement> get(String instanceId) {
        int handle = storage.handles.getInt(Objects.requireNonNull(instanceId, "instanceId"));
        return handle == NO_HANDLE ? Optional.empty() : Optional.of(storage.arena.get(handle));
    }

    /**
     * Returns all placements in timeline order.
     */
    public List<Placement> placements() {
        List<Placement> result = new ArrayList<>(storage.order.size());
        for (int i = 0; i < storage.order.size(); i++) {
            result.add(storage.arena.get(storage.order.getInt(i)));
        }
        return result;
    }

    /**
     * Returns placements of one definition in timeline order.
     */
    public List<Placement> placementsOf(String definitionId) {
        List<Placement> result = new ArrayList<>();
        for (int i = 0; i < storage.order.size(); i++) {
            Placement placement = storage.arena.get(storage.order.getInt(i));
            if (placement.definitionId().equals(definitionId)) {
                result.add(placement);
            }
        }
        return result;
    }

    /**
     * Returns placements whose range intersects {@code [fromMinute, toMinute)}, in timeline order.
     */
    public List<Placement> placementsBetween(long fromMinute, long toMinute) {
        List<Placement> result = new ArrayList<>();
        for (int i = 0; i < storage.order.size(); i++) {
            Placement placement = storage.arena.get(storage.order.getInt(i));
            if (placement.getStartMinute() >= toMinute) {
                break;
            }
            if (placement.getEndMinute() > fromMinute) {
                result.add(placement);
            }
        }
        return result;
    }

    /**
     * Returns the placement starting exactly at {@code minute}, if any.
     */
    public Optional<Placement> startingAt(long minute) {
        int position = lowerBound(minute);
        if (position < storage.order.size()) {
            Placement candidate = storage.arena.get(storage.order.getInt(position));
            if (candidate.getStartMinute() == minute) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Inserts one placement.
     *
     * @throws IllegalStateException when the instance is already placed or the placement
     *                               overlaps a neighbour once travel is accounted for.
     */
    public void place(Placement placement) {
        Objects.requireNonNull(placement, "placement");
        if (contains(placement.instanceId())) {
            throw new IllegalStateException("instance already placed: " + placement.instanceId());
        }
        int position = insertionPoint(placement);
        Storage current = storage;
        if (position > 0) {
            Placement previous = current.arena.get(current.order.getInt(position - 1));
            requireGap(previous, placement, placement.getTravelIn().getDurationMinutes());
        }
        if (position < current.order.size()) {
            Placement next = current.arena.get(current.order.getInt(position));
            requireGap(placement, next, placement.getTravelOut().getDurationMinutes());
        }

        Storage writable = writable();
        int handle = writable.arena.size();
        writable.arena.add(placement);
        writable.order.add(position, handle);
        writable.handles.put(placement.instanceId(), handle);
    }

    /**
     * Removes one placement.
     *
     * @return the removed placement, or empty when the instance was not placed.
     */
    public Optional<Placement> remove(String instanceId) {
        int handle = storage.handles.getInt(Objects.requireNonNull(instanceId, "instanceId"));
        if (handle == NO_HANDLE) {
            return Optional.empty();
        }
        Storage writable = writable();
        Placement removed = writable.arena.set(handle, null);
        writable.order.rem(handle);
        writable.handles.removeInt(instanceId);
        return Optional.of(removed);
    }

    /**
     * Replaces the travel-in segment of one placement.
     */
    public void retravel(String instanceId, TravelSegment travelIn) {
        int handle = storage.handles.getInt(Objects.requireNonNull(instanceId, "instanceId"));
        if (handle == NO_HANDLE) {
            throw new IllegalStateException("instance not placed: " + instanceId);
        }
        Storage writable = writable();
        writable.arena.set(handle, writable.arena.get(handle).withTravelIn(travelIn));
    }

    private Storage writable() {
        if (!ownsStorage) {
            storage = storage.copy();
            ownsStorage = true;
        }
        return storage;
    }

    private int insertionPoint(Placement placement) {
        int low = 0;
        int high = storage.order.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            Placement midpoint = storage.arena.get(storage.order.getInt(mid));
            int cmp = Long.compare(midpoint.getStartMinute(), placement.getStartMinute());
            if (cmp == 0) {
                cmp = midpoint.instanceId().compareTo(placement.instanceId());
            }
            if (cmp < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private int lowerBound(long minute) {
        int low = 0;
        int high = storage.order.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (storage.arena.get(storage.order.getInt(mid)).getStartMinute() < minute) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static void requireGap(Placement earlier, Placement later, int travelMinutes) {
        long gap = later.getStartMinute() - earlier.getEndMinute();
        long needed = sameDay(earlier, later) ? travelMinutes : 0;
        if (gap < needed) {
            throw new IllegalStateException("placement " + later.instanceId() + " at "
                    + TimeUtils.formatHorizonMinute(later.getStartMinute()) + " overlaps "
                    + earlier.instanceId() + " (gap " + gap + " min, travel " + needed + " min)");
        }
    }

    private static boolean sameDay(Placement earlier, Placement later) {
        return TimeUtils.dayIndex(earlier.getStartMinute()) == TimeUtils.dayIndex(later.getStartMinute());
    }

    private static Object2IntOpenHashMap<String> newHandleIndex() {
        Object2IntOpenHashMap<String> index = new Object2IntOpenHashMap<>();
        index.defaultReturnValue(NO_HANDLE);
        return index;
    }

    private record Storage(
            ObjectArrayList<Placement> arena,
            IntArrayList order,
            Object2IntOpenHashMap<String> handles
    ) {
        Storage copy() {
            Object2IntOpenHashMap<String> handlesCopy = new Object2IntOpenHashMap<>(handles);
            handlesCopy.defaultReturnValue(NO_HANDLE);
            return new Storage(new ObjectArrayList<>(arena), new IntArrayList(order), handlesCopy);
        }
    }
}
