package org.errandplanner.scheduling.core;

import lombok.Value;
import org.errandplanner.scheduling.model.BlockingReason;
import org.errandplanner.scheduling.model.ErrandInstance;

/**
 * Instance that could not be placed, even after cascading.
 */
@Value
public class UnschedulableErrand {
    ErrandInstance instance;
    BlockingReason blockingReason;

    public String instanceId() {
        return instance.getId();
    }
}
