package org.errandplanner.scheduling.travel;

import org.errandplanner.scheduling.model.LocationSpec;
import org.errandplanner.scheduling.model.Place;

import java.util.List;

/**
 * External places collaborator used for open (store-category) locations.
 */
public interface LocationResolver {

    /**
     * Lists candidate branches reachable from an origin.
     *
     * @param spec open location specification.
     * @param origin where the user departs from.
     * @param radiusBudgetMinutes travel budget available in the interval.
     * @return candidates ordered by the resolver's own preference.
     * @throws ProviderException when the resolver cannot answer.
     */
    List<LocationCandidate> candidates(LocationSpec spec, Place origin, int radiusBudgetMinutes);
}
