package org.errandplanner.scheduling.travel;

import org.errandplanner.scheduling.model.AccessType;
import org.errandplanner.scheduling.model.Place;

import java.time.LocalDateTime;

/**
 * External directions collaborator.
 *
 * <p>Implementations must be safe for concurrent read-only calls.</p>
 */
public interface TravelTimeProvider {

    /**
     * Estimates travel between two places.
     *
     * @param origin trip origin.
     * @param destination trip destination.
     * @param accessType travel mode.
     * @param departure local departure time.
     * @return duration/feasibility estimate.
     * @throws ProviderException when the provider cannot answer.
     */
    TravelEstimate estimate(Place origin, Place destination, AccessType accessType, LocalDateTime departure);
}
