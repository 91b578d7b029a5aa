package org.errandplanner.scheduling.model;

import lombok.Value;

import java.util.Objects;

/**
 * A location the user can be at: home, a store branch, a calendar event venue.
 *
 * <p>The label is what travel providers geocode when no coordinate is attached.</p>
 */
@Value
public class Place {
    String label;
    Coordinate coordinate;

    private Place(String label, Coordinate coordinate) {
        String nonNullLabel = Objects.requireNonNull(label, "label").trim();
        if (nonNullLabel.isEmpty()) {
            throw new IllegalArgumentException("place label must be non-blank");
        }
        this.label = nonNullLabel;
        this.coordinate = coordinate;
    }

    /**
     * Creates a place known only by name or address.
     */
    public static Place named(String label) {
        return new Place(label, null);
    }

    /**
     * Creates a place with an attached coordinate.
     */
    public static Place at(String label, double latitude, double longitude) {
        return new Place(label, Coordinate.of(latitude, longitude));
    }

    /**
     * Creates a place with an attached coordinate.
     */
    public static Place at(String label, Coordinate coordinate) {
        return new Place(label, Objects.requireNonNull(coordinate, "coordinate"));
    }

    @Override
    public String toString() {
        return coordinate == null ? label : label + "(" + coordinate + ")";
    }
}
