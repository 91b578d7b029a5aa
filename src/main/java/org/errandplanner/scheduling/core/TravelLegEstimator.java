package org.errandplanner.scheduling.core;

import org.errandplanner.scheduling.model.AccessType;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.PlanningHorizon;
import org.errandplanner.scheduling.travel.TravelEstimate;
import org.errandplanner.scheduling.travel.TravelGateway;

import java.util.Objects;

/**
 * Travel between two location contexts of the timeline.
 *
 * <p>A context is either a concrete place, opaque (an unlocated calendar event), or absent
 * (end of day). Rules:</p>
 * <ul>
 * <li>Nothing to reach at end of day costs nothing.</li>
 * <li>Opaque to opaque costs nothing; the user stays wherever they are.</li>
 * <li>Legs touching an opaque side are estimated from or to home, plus a fixed penalty.</li>
 * </ul>
 */
final class TravelLegEstimator {
    private final TravelGateway gateway;
    private final PlanningHorizon horizon;
    private final Place home;
    private final int unknownLocationPenaltyMinutes;

    TravelLegEstimator(TravelGateway gateway, PlanningHorizon horizon, Place home, int unknownLocationPenaltyMinutes) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.horizon = Objects.requireNonNull(horizon, "horizon");
        this.home = Objects.requireNonNull(home, "home");
        if (unknownLocationPenaltyMinutes < 0) {
            throw new IllegalArgumentException("unknownLocationPenaltyMinutes must be >= 0");
        }
        this.unknownLocationPenaltyMinutes = unknownLocationPenaltyMinutes;
    }

    TravelGateway gateway() {
        return gateway;
    }

    Place home() {
        return home;
    }

    TravelEstimate leg(
            Place from,
            boolean fromOpaque,
            Place to,
            boolean toOpaque,
            AccessType accessType,
            long departureMinute
    ) {
        if (fromOpaque && toOpaque) {
            return TravelEstimate.noTravel();
        }
        if (to == null && !toOpaque) {
            return TravelEstimate.noTravel();
        }
        Place origin = fromOpaque || from == null ? home : from;
        Place destination = toOpaque ? home : to;
        TravelEstimate estimate = gateway.estimate(origin, destination, accessType, horizon.toDateTime(departureMinute));
        if (fromOpaque || toOpaque) {
            return penalize(estimate);
        }
        return estimate;
    }

    private TravelEstimate penalize(TravelEstimate estimate) {
        if (!estimate.isFeasible() || unknownLocationPenaltyMinutes == 0) {
            return estimate;
        }
        return TravelEstimate.feasible(
                estimate.getDurationMinutes() + unknownLocationPenaltyMinutes,
                estimate.getTransfers()
        );
    }
}
