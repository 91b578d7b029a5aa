package org.errandplanner.scheduling.core;

import org.errandplanner.core.time.TimeUtils;
import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.LocationSpec;
import org.errandplanner.scheduling.model.TimeWindow;

/**
 * Shape checks applied to every definition before expansion.
 */
public final class DefinitionValidator {
    public static final String REASON_ID_REQUIRED = "EV_ID_REQUIRED";
    public static final String REASON_TITLE_REQUIRED = "EV_TITLE_REQUIRED";
    public static final String REASON_LOCATION_REQUIRED = "EV_LOCATION_REQUIRED";
    public static final String REASON_ACCESS_TYPE_REQUIRED = "EV_ACCESS_TYPE_REQUIRED";
    public static final String REASON_WINDOW_REQUIRED = "EV_WINDOW_REQUIRED";
    public static final String REASON_WINDOW_OUT_OF_RANGE = "EV_WINDOW_OUT_OF_RANGE";
    public static final String REASON_WINDOW_INVERTED = "EV_WINDOW_INVERTED";
    public static final String REASON_DURATION_NOT_POSITIVE = "EV_DURATION_NOT_POSITIVE";
    public static final String REASON_DURATION_EXCEEDS_WINDOW = "EV_DURATION_EXCEEDS_WINDOW";
    public static final String REASON_MINIMUM_DURATION_INVALID = "EV_MINIMUM_DURATION_INVALID";
    public static final String REASON_PRIORITY_NEGATIVE = "EV_PRIORITY_NEGATIVE";
    public static final String REASON_SELF_CONFLICT = "EV_SELF_CONFLICT";
    public static final String REASON_DUPLICATE_ID = "EV_DUPLICATE_ID";
    public static final String REASON_SELF_COMPLEMENT = "EV_SELF_COMPLEMENT";
    public static final String REASON_COMPLEMENT_CONFLICTS = "EV_COMPLEMENT_CONFLICTS";

    /**
     * Validates one definition.
     *
     * @throws ErrandValidationException on the first violated rule.
     */
    public void validate(ErrandDefinition definition) {
        if (definition == null) {
            throw new ErrandValidationException(null, REASON_ID_REQUIRED, "definition must be non-null");
        }
        String id = definition.getId();
        if (id == null || id.isBlank()) {
            throw new ErrandValidationException(id, REASON_ID_REQUIRED, "definition id must be non-blank");
        }
        if (definition.getTitle() == null || definition.getTitle().isBlank()) {
            throw new ErrandValidationException(id, REASON_TITLE_REQUIRED, "title must be non-blank for " + id);
        }
        validateLocation(id, definition.getLocation());
        if (definition.getAccessType() == null) {
            throw new ErrandValidationException(id, REASON_ACCESS_TYPE_REQUIRED, "access type is required for " + id);
        }
        if (definition.getPriority() < 0) {
            throw new ErrandValidationException(
                    id, REASON_PRIORITY_NEGATIVE, "priority must be >= 0, got " + definition.getPriority());
        }

        TimeWindow window = definition.getValidWindow();
        if (window == null) {
            throw new ErrandValidationException(id, REASON_WINDOW_REQUIRED, "valid window is required for " + id);
        }
        if (window.getStartMinute() < 0 || window.getEndMinute() > TimeUtils.MINUTES_PER_DAY) {
            throw new ErrandValidationException(
                    id, REASON_WINDOW_OUT_OF_RANGE, "valid window " + window + " leaves the day");
        }
        if (window.getStartMinute() >= window.getEndMinute()) {
            throw new ErrandValidationException(
                    id, REASON_WINDOW_INVERTED, "valid window start must precede end, got " + window);
        }

        int duration = definition.getEstimatedDurationMinutes();
        if (duration <= 0) {
            throw new ErrandValidationException(
                    id, REASON_DURATION_NOT_POSITIVE, "estimated duration must be > 0, got " + duration);
        }
        if (duration > window.lengthMinutes()) {
            throw new ErrandValidationException(
                    id,
                    REASON_DURATION_EXCEEDS_WINDOW,
                    "estimated duration " + duration + " min exceeds valid window " + window
            );
        }
        Integer minimum = definition.getMinimumDurationMinutes();
        if (minimum != null && (minimum <= 0 || minimum > duration)) {
            throw new ErrandValidationException(
                    id,
                    REASON_MINIMUM_DURATION_INVALID,
                    "minimum duration must be in [1, " + duration + "], got " + minimum
            );
        }
        if (definition.getConflictingDefinitionIds().contains(id)) {
            throw new ErrandValidationException(id, REASON_SELF_CONFLICT, id + " cannot conflict with itself");
        }
        if (definition.getComplementaryDefinitionIds().contains(id)) {
            throw new ErrandValidationException(id, REASON_SELF_COMPLEMENT, id + " cannot complement itself");
        }
        for (String complement : definition.getComplementaryDefinitionIds()) {
            if (definition.getConflictingDefinitionIds().contains(complement)) {
                throw new ErrandValidationException(
                        id,
                        REASON_COMPLEMENT_CONFLICTS,
                        complement + " is listed as both complementary and conflicting for " + id
                );
            }
        }
    }

    private static void validateLocation(String id, LocationSpec location) {
        if (location == null) {
            throw new ErrandValidationException(id, REASON_LOCATION_REQUIRED, "location is required for " + id);
        }
        switch (location.getKind()) {
            case EXACT_COORDINATE, NAMED_PLACE -> {
                if (location.getPlace() == null) {
                    throw new ErrandValidationException(
                            id, REASON_LOCATION_REQUIRED, "fixed location needs a place for " + id);
                }
            }
            case STORE_CATEGORY -> {
                if (location.getStoreCategory() == null) {
                    throw new ErrandValidationException(
                            id, REASON_LOCATION_REQUIRED, "open location needs a store category for " + id);
                }
            }
            case REMOTE -> {
            }
        }
    }
}
