package org.errandplanner.scheduling.recurrence;

import lombok.Getter;
import org.errandplanner.scheduling.core.SchedulingException;

/**
 * Internally inconsistent repetition rule; the definition is skipped for the run.
 */
@Getter
public final class InvalidRecurrenceException extends SchedulingException {
    private final String definitionId;

    public InvalidRecurrenceException(String definitionId, String reasonCode, String message) {
        super(reasonCode, message);
        this.definitionId = definitionId;
    }
}
