package org.errandplanner.scheduling.model;

import lombok.ToString;
import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One concrete occurrence of a definition for a planning run.
 *
 * <p>The instance may land on any date in {@code [earliestDate, latestDate]}; the range is
 * the target date widened by the definition's tolerance and clamped to the horizon.</p>
 */
@Value
public class ErrandInstance {
    String id;
    @ToString.Exclude
    ErrandDefinition definition;
    LocalDate targetDate;
    LocalDate earliestDate;
    LocalDate latestDate;

    private ErrandInstance(ErrandDefinition definition, LocalDate targetDate, LocalDate earliestDate, LocalDate latestDate) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.targetDate = Objects.requireNonNull(targetDate, "targetDate");
        this.earliestDate = Objects.requireNonNull(earliestDate, "earliestDate");
        this.latestDate = Objects.requireNonNull(latestDate, "latestDate");
        if (latestDate.isBefore(earliestDate)) {
            throw new IllegalArgumentException("latestDate must not precede earliestDate");
        }
        this.id = idFor(definition.getId(), targetDate);
    }

    /**
     * Creates an instance with an explicit landing-date range.
     */
    public static ErrandInstance of(ErrandDefinition definition, LocalDate targetDate, LocalDate earliestDate, LocalDate latestDate) {
        return new ErrandInstance(definition, targetDate, earliestDate, latestDate);
    }

    /**
     * Creates an instance pinned to its target date.
     */
    public static ErrandInstance onDate(ErrandDefinition definition, LocalDate date) {
        return new ErrandInstance(definition, date, date, date);
    }

    /**
     * Canonical instance id: {@code <definitionId>@<targetDate>}.
     */
    public static String idFor(String definitionId, LocalDate targetDate) {
        return definitionId + "@" + targetDate;
    }

    public String definitionId() {
        return definition.getId();
    }

    public int priority() {
        return definition.getPriority();
    }
}
