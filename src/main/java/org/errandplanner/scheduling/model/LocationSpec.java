package org.errandplanner.scheduling.model;

import lombok.Value;

import java.util.Objects;

/**
 * Closed location specification of an errand.
 *
 * <p>Fixed kinds ({@link LocationKind#EXACT_COORDINATE}, {@link LocationKind#NAMED_PLACE})
 * carry a {@link Place}; {@link LocationKind#STORE_CATEGORY} carries the category that
 * {@code LocationResolver} expands into branches; {@link LocationKind#REMOTE} carries nothing.</p>
 */
@Value
public class LocationSpec {
    private static final LocationSpec REMOTE = new LocationSpec(LocationKind.REMOTE, null, null);

    LocationKind kind;
    Place place;
    String storeCategory;

    private LocationSpec(LocationKind kind, Place place, String storeCategory) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.place = place;
        this.storeCategory = storeCategory;
    }

    /**
     * Creates an exact-coordinate destination.
     */
    public static LocationSpec ofCoordinate(String label, double latitude, double longitude) {
        return new LocationSpec(LocationKind.EXACT_COORDINATE, Place.at(label, latitude, longitude), null);
    }

    /**
     * Creates a named destination (store name or street address).
     */
    public static LocationSpec ofNamedPlace(String name) {
        return new LocationSpec(LocationKind.NAMED_PLACE, Place.named(name), null);
    }

    /**
     * Creates a named destination whose coordinate is already known.
     */
    public static LocationSpec ofPlace(Place place) {
        Place nonNull = Objects.requireNonNull(place, "place");
        LocationKind kind = nonNull.getCoordinate() == null ? LocationKind.NAMED_PLACE : LocationKind.EXACT_COORDINATE;
        return new LocationSpec(kind, nonNull, null);
    }

    /**
     * Creates an open destination: any branch of the given store category.
     */
    public static LocationSpec ofStoreCategory(String storeCategory) {
        String category = Objects.requireNonNull(storeCategory, "storeCategory").trim();
        if (category.isEmpty()) {
            throw new IllegalArgumentException("store category must be non-blank");
        }
        return new LocationSpec(LocationKind.STORE_CATEGORY, null, category);
    }

    /**
     * Returns the remote (no travel) specification.
     */
    public static LocationSpec remote() {
        return REMOTE;
    }
}
