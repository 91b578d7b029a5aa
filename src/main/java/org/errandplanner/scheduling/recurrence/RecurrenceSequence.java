package org.errandplanner.scheduling.recurrence;

import org.errandplanner.scheduling.model.ErrandInstance;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Lazy, feedback-driven stream of instances for one definition.
 *
 * <p>Calendar rules yield instances independently of placement. Placement-dependent rules
 * ({@code EVERY_N_DAYS}) yield nothing while an instance is outstanding; the next
 * candidate is produced only after {@link #confirm} or {@link #skip}.</p>
 */
public interface RecurrenceSequence {

    /**
     * Returns the next instance ready for placement, or empty when none is ready now.
     */
    Optional<ErrandInstance> next();

    /**
     * Records that an instance was committed on {@code placedDate}.
     */
    void confirm(ErrandInstance instance, LocalDate placedDate);

    /**
     * Records that a confirmed instance was moved from {@code fromDate} to {@code toDate}
     * after the fact, for example by a cascade.
     *
     * @return true when the move changed what this sequence yields next; an instance it
     *         already yielded and that is still waiting for placement is withdrawn, and the
     *         caller should drop it and ask {@link #next()} again.
     */
    boolean relocate(ErrandInstance instance, LocalDate fromDate, LocalDate toDate);

    /**
     * Records that an instance could not be placed.
     */
    void skip(ErrandInstance instance);

    /**
     * Returns whether the sequence can never yield again.
     */
    boolean exhausted();
}
