package org.errandplanner.scheduling.model;

/**
 * Per-run lifecycle of one errand instance.
 *
 * <p>Allowed transitions: {@code UNSCHEDULED -> PLACED},
 * {@code UNSCHEDULED -> TENTATIVELY_DISPLACING -> PLACED | UNSCHEDULABLE}.</p>
 */
public enum InstanceStatus {
    UNSCHEDULED,
    TENTATIVELY_DISPLACING,
    PLACED,
    UNSCHEDULABLE;

    /**
     * Returns whether moving from this status to {@code next} is a legal transition.
     */
    public boolean canTransitionTo(InstanceStatus next) {
        return switch (this) {
            case UNSCHEDULED -> next == PLACED || next == TENTATIVELY_DISPLACING;
            case TENTATIVELY_DISPLACING -> next == PLACED || next == UNSCHEDULABLE;
            case PLACED, UNSCHEDULABLE -> false;
        };
    }
}
