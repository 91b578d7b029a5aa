package org.errandplanner.scheduling.core;

/**
 * Raised when a running pass detects that its inputs went stale; nothing from the pass is kept.
 */
public final class PlanningCancelledException extends SchedulingException {

    public PlanningCancelledException(String message) {
        super(ErrandPlanner.REASON_PASS_CANCELLED, message);
    }
}
