package org.errandplanner.scheduling.core;

import lombok.Getter;

/**
 * Malformed errand definition, rejected before expansion.
 */
@Getter
public final class ErrandValidationException extends SchedulingException {
    private final String definitionId;

    public ErrandValidationException(String definitionId, String reasonCode, String message) {
        super(reasonCode, message);
        this.definitionId = definitionId;
    }
}
