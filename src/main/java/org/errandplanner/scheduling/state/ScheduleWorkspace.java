package org.errandplanner.scheduling.state;

import org.errandplanner.scheduling.ledger.FreeInterval;
import org.errandplanner.scheduling.ledger.FreeTimeLedger;
import org.errandplanner.scheduling.model.Placement;
import org.errandplanner.scheduling.model.TravelSegment;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Committed timeline paired with the free-time ledger derived from it.
 *
 * <p>Writers go through one {@link ReentrantLock}; every successful write bumps a version
 * counter. Forks copy both halves lazily and can be adopted only while the parent is still
 * at the version the fork was taken from, so an adopted branch never hides a concurrent
 * commit.</p>
 */
public final class ScheduleWorkspace {
    private final ReentrantLock writeLock = new ReentrantLock();
    private final ScheduleWorkspace parent;
    private final long baseVersion;

    private ScheduleState state;
    private FreeTimeLedger ledger;
    private long version;

    public ScheduleWorkspace(FreeTimeLedger ledger) {
        this(new ScheduleState(), Objects.requireNonNull(ledger, "ledger"), null, 0L);
    }

    private ScheduleWorkspace(ScheduleState state, FreeTimeLedger ledger, ScheduleWorkspace parent, long baseVersion) {
        this.state = state;
        this.ledger = ledger;
        this.parent = parent;
        this.baseVersion = baseVersion;
    }

    /**
     * Current timeline. Callers must treat it as read-only; writes go through this workspace.
     */
    public ScheduleState state() {
        return state;
    }

    /**
     * Current free-time view. Callers must treat it as read-only.
     */
    public FreeTimeLedger ledger() {
        return ledger;
    }

    public long version() {
        return version;
    }

    /**
     * Returns a speculative branch; nothing done to it is visible here until {@link #adopt}.
     */
    public ScheduleWorkspace fork() {
        writeLock.lock();
        try {
            return new ScheduleWorkspace(state.fork(), ledger.fork(), this, version);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replaces this workspace's contents with a fork taken from it.
     *
     * @throws WorkspaceConflictException when the fork belongs to another workspace or this
     *                                     workspace changed after the fork was taken.
     */
    public void adopt(ScheduleWorkspace fork) {
        Objects.requireNonNull(fork, "fork");
        writeLock.lock();
        try {
            if (fork.parent != this) {
                throw new WorkspaceConflictException("workspace fork was not taken from this workspace");
            }
            if (fork.baseVersion != version) {
                throw new WorkspaceConflictException("workspace changed since fork (fork base "
                        + fork.baseVersion + ", current " + version + ")");
            }
            state = fork.state.fork();
            ledger = fork.ledger.fork();
            version++;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Commits one placement: reserves its range, inserts it, and rewrites the travel-in of a
     * directly following placement with the new placement's travel-out.
     *
     * @throws WorkspaceConflictException when the range is not free or spacing would break;
     *                                     the workspace is unchanged in that case.
     */
    public void commit(Placement placement) {
        Objects.requireNonNull(placement, "placement");
        writeLock.lock();
        try {
            Optional<Placement> successor = directSuccessor(placement.getStartMinute());
            try {
                ledger.reserve(placement);
            } catch (IllegalStateException ex) {
                throw new WorkspaceConflictException(ex.getMessage(), ex);
            }
            try {
                state.place(placement);
            } catch (IllegalStateException ex) {
                ledger.release(placement.instanceId());
                throw new WorkspaceConflictException(ex.getMessage(), ex);
            }
            if (successor.isPresent()) {
                state.retravel(successor.get().instanceId(), placement.getTravelOut());
            }
            version++;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes one placement and frees its range.
     *
     * @return the removed placement, or empty when the instance was not placed.
     */
    public Optional<Placement> withdraw(String instanceId) {
        writeLock.lock();
        try {
            Optional<Placement> removed = state.remove(instanceId);
            if (removed.isPresent()) {
                ledger.release(instanceId);
                version++;
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replaces the travel-in of one committed placement.
     */
    public void retravel(String instanceId, TravelSegment travelIn) {
        writeLock.lock();
        try {
            state.retravel(instanceId, travelIn);
            version++;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns the free interval containing {@code minute}, if the minute is free.
     */
    public Optional<FreeInterval> freeIntervalAt(long minute) {
        List<FreeInterval> hits = ledger.intervalsIntersecting(minute, minute + 1);
        return hits.isEmpty() ? Optional.empty() : Optional.of(hits.get(0));
    }

    /**
     * Returns the placement that directly follows the free interval containing {@code minute},
     * with no calendar event in between.
     */
    public Optional<Placement> directSuccessor(long minute) {
        Optional<FreeInterval> interval = freeIntervalAt(minute);
        if (interval.isEmpty() || interval.get().isEndOfDay()) {
            return Optional.empty();
        }
        return state.startingAt(interval.get().getEndMinute());
    }
}
