package org.errandplanner.scheduling.travel;

import lombok.Value;
import org.errandplanner.scheduling.model.Place;

/**
 * One concrete branch returned for an open location.
 */
@Value
public class LocationCandidate {
    Place place;
    /** Resolver's own rough travel estimate in minutes, or null when unknown. */
    Integer travelHintMinutes;

    public static LocationCandidate of(Place place, Integer travelHintMinutes) {
        return new LocationCandidate(place, travelHintMinutes);
    }
}
