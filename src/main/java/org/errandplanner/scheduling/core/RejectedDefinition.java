package org.errandplanner.scheduling.core;

import lombok.Value;

/**
 * Definition (or pinned occurrence) refused before scheduling, with its reason code.
 */
@Value
public class RejectedDefinition {
    String definitionId;
    String reasonCode;
    String message;
}
