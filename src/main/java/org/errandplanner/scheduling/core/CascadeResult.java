package org.errandplanner.scheduling.core;

import lombok.Value;
import org.errandplanner.scheduling.model.BlockingReason;
import org.errandplanner.scheduling.model.Placement;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one cascade attempt.
 *
 * <p>On success {@code displacedInstanceIds} lists the instances that were moved, in chain
 * order; each of them is placed again somewhere in the adopted workspace.</p>
 */
@Value
public class CascadeResult {
    Placement placement;
    List<String> displacedInstanceIds;
    BlockingReason blockingReason;

    public static CascadeResult placed(Placement placement, List<String> displacedInstanceIds) {
        return new CascadeResult(
                Objects.requireNonNull(placement, "placement"),
                List.copyOf(displacedInstanceIds),
                null
        );
    }

    public static CascadeResult stillUnschedulable(BlockingReason blockingReason) {
        return new CascadeResult(null, List.of(), Objects.requireNonNull(blockingReason, "blockingReason"));
    }

    public boolean isPlaced() {
        return placement != null;
    }
}
