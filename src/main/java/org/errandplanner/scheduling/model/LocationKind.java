package org.errandplanner.scheduling.model;

/**
 * Discriminator for {@link LocationSpec} payloads.
 */
public enum LocationKind {
    /**
     * Fixed latitude/longitude destination.
     */
    EXACT_COORDINATE,

    /**
     * Fixed destination known by name or address; coordinates are optional.
     */
    NAMED_PLACE,

    /**
     * Open destination: any branch of a store category, resolved per free interval.
     */
    STORE_CATEGORY,

    /**
     * No travel required (phone calls, online tasks).
     */
    REMOTE;

    /**
     * Returns whether the destination is fixed before placement starts.
     */
    public boolean isFixed() {
        return this == EXACT_COORDINATE || this == NAMED_PLACE;
    }
}
