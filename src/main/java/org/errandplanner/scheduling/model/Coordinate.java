package org.errandplanner.scheduling.model;

import lombok.Value;

/**
 * Validated latitude/longitude pair.
 */
@Value
public class Coordinate {
    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LON = -180.0d;
    private static final double MAX_LON = 180.0d;

    double latitude;
    double longitude;

    private Coordinate(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new IllegalArgumentException("coordinates must be finite");
        }
        if (latitude < MIN_LAT || latitude > MAX_LAT || longitude < MIN_LON || longitude > MAX_LON) {
            throw new IllegalArgumentException("coordinates must be in [-90,90] and [-180,180]");
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Creates a validated coordinate.
     */
    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return latitude + "," + longitude;
    }
}
