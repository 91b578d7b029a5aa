package org.errandplanner.scheduling.core;

import lombok.Value;
import org.errandplanner.scheduling.model.BlockingReason;
import org.errandplanner.scheduling.model.Placement;

import java.util.Objects;

/**
 * Outcome of one placement search: either a placement, or the dominant reason none exists.
 */
@Value
public class PlacementResult {
    Placement placement;
    BlockingReason blockingReason;

    public static PlacementResult scheduled(Placement placement) {
        return new PlacementResult(Objects.requireNonNull(placement, "placement"), null);
    }

    public static PlacementResult failed(BlockingReason blockingReason) {
        return new PlacementResult(null, Objects.requireNonNull(blockingReason, "blockingReason"));
    }

    public boolean isScheduled() {
        return placement != null;
    }
}
