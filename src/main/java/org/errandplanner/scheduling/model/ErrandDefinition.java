package org.errandplanner.scheduling.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Immutable errand template created by the user.
 *
 * <p>The engine never mutates definitions; edits produce a new definition through
 * {@link #toBuilder()}.</p>
 */
@Value
@Builder(toBuilder = true)
public class ErrandDefinition {
    /** Stable identifier; also the lexical tie-break key. */
    String id;
    /** Display title. */
    String title;
    /** Where the errand happens. */
    LocationSpec location;
    /** How the user travels there. */
    AccessType accessType;
    /** Priority tier, higher tiers are scheduled first. */
    int priority;
    /** Estimated duration in minutes. */
    int estimatedDurationMinutes;
    /** Optional shorter duration accepted when the full duration fits nowhere. */
    Integer minimumDurationMinutes;
    /** Time-of-day window the errand must run in. */
    TimeWindow validWindow;
    /** Repetition rule. */
    @Builder.Default
    RepetitionRule repetition = RepetitionRule.none();
    /** Spacing and date tolerance between occurrences. */
    @Builder.Default
    IntervalRange intervalRange = IntervalRange.none();
    /** Definitions that must never land on the same day as this one. */
    @Singular
    Set<String> conflictingDefinitionIds;
    /** Definitions this one is paired with; the flags below say how the pair is bound. */
    @Singular
    Set<String> complementaryDefinitionIds;
    /** Land on a day that already holds a complementary errand, when one is placed nearby. */
    boolean sameDayRequired;
    /** Start only after every complementary errand placed on the same day has ended. */
    boolean orderRequired;
    /** Prefer the place where a same-day complementary errand happens. */
    boolean sameLocationRequired;
}
