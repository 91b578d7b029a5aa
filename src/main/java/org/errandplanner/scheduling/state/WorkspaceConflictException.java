package org.errandplanner.scheduling.state;

/**
 * A workspace write was refused because the timeline does not allow it: the range is taken,
 * travel spacing would break, or a fork went stale. The workspace is unchanged.
 */
public class WorkspaceConflictException extends IllegalStateException {
    public WorkspaceConflictException(String message) {
        super(message);
    }

    public WorkspaceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
