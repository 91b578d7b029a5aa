package org.errandplanner.scheduling.ledger;

import lombok.Value;
import org.errandplanner.scheduling.model.Place;

/**
 * Free span {@code [startMinute, endMinute)} in horizon minutes, tagged with where the user
 * comes from and where they must be next.
 *
 * <p>An opaque side borders an unlocated calendar event: its location is unknown, so travel
 * across it is estimated from or to home with a penalty.</p>
 */
@Value
public class FreeInterval {
    long startMinute;
    long endMinute;
    /** Location at interval start; null when opaque. */
    Place origin;
    boolean originOpaque;
    /** Location required at interval end; null when opaque or at end of day. */
    Place next;
    boolean nextOpaque;
    /** Whether the interval runs until midnight with nothing after it. */
    boolean endOfDay;

    public long spanMinutes() {
        return endMinute - startMinute;
    }

    public boolean intersects(long fromMinute, long toMinute) {
        return startMinute < toMinute && fromMinute < endMinute;
    }
}
