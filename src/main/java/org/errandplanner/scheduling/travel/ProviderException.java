package org.errandplanner.scheduling.travel;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Failure reported by a travel, location or calendar collaborator.
 *
 * <p>Callers inside the engine retry these with bounded backoff and then treat the
 * affected candidate as infeasible instead of aborting the pass.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ProviderException extends RuntimeException {
    private final String reasonCode;

    public ProviderException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public ProviderException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }
}
