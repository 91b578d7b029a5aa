package org.errandplanner.scheduling.model;

/**
 * Mode of transportation used to reach an errand location.
 */
public enum AccessType {
    DRIVE(false),
    BUS(true),
    TRAIN(true),
    ALL_TRANSIT(true),
    BIKE(false),
    WALK(false);

    private final boolean transit;

    AccessType(boolean transit) {
        this.transit = transit;
    }

    /**
     * Returns whether this access type rides public transit (and therefore has line changes).
     */
    public boolean isTransit() {
        return transit;
    }
}
