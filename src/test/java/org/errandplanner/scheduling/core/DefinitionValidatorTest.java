package org.errandplanner.scheduling.core;

import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.errandplanner.scheduling.testutil.PlannerFixtures.remote;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefinitionValidator Tests")
class DefinitionValidatorTest {

    private final DefinitionValidator validator = new DefinitionValidator();

    private static ErrandDefinition.ErrandDefinitionBuilder valid() {
        return remote("errand", 2, "0900", "1100", 30);
    }

    static Stream<Arguments> invalidDefinitions() {
        return Stream.of(
                Arguments.of("blank id", valid().id(" ").build(), DefinitionValidator.REASON_ID_REQUIRED),
                Arguments.of("missing title", valid().title(null).build(), DefinitionValidator.REASON_TITLE_REQUIRED),
                Arguments.of("missing location", valid().location(null).build(), DefinitionValidator.REASON_LOCATION_REQUIRED),
                Arguments.of("missing access type", valid().accessType(null).build(), DefinitionValidator.REASON_ACCESS_TYPE_REQUIRED),
                Arguments.of("negative priority", valid().priority(-1).build(), DefinitionValidator.REASON_PRIORITY_NEGATIVE),
                Arguments.of("missing window", valid().validWindow(null).build(), DefinitionValidator.REASON_WINDOW_REQUIRED),
                Arguments.of("window past midnight", valid().validWindow(TimeWindow.of(1380, 1500)).build(),
                        DefinitionValidator.REASON_WINDOW_OUT_OF_RANGE),
                Arguments.of("inverted window", valid().validWindow(TimeWindow.ofHhmm("1100", "0900")).build(),
                        DefinitionValidator.REASON_WINDOW_INVERTED),
                Arguments.of("zero duration", valid().estimatedDurationMinutes(0).build(),
                        DefinitionValidator.REASON_DURATION_NOT_POSITIVE),
                Arguments.of("duration longer than window", valid().estimatedDurationMinutes(121).build(),
                        DefinitionValidator.REASON_DURATION_EXCEEDS_WINDOW),
                Arguments.of("minimum above estimate", valid().minimumDurationMinutes(45).build(),
                        DefinitionValidator.REASON_MINIMUM_DURATION_INVALID),
                Arguments.of("conflicts with itself", valid().conflictingDefinitionId("errand").build(),
                        DefinitionValidator.REASON_SELF_CONFLICT),
                Arguments.of("complements itself", valid().complementaryDefinitionId("errand").build(),
                        DefinitionValidator.REASON_SELF_COMPLEMENT),
                Arguments.of("complements and conflicts with the same errand", valid()
                                .complementaryDefinitionId("laundry")
                                .conflictingDefinitionId("laundry")
                                .build(),
                        DefinitionValidator.REASON_COMPLEMENT_CONFLICTS)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("invalidDefinitions")
    @DisplayName("Malformed definitions are rejected with a stable reason code")
    void testRejections(String label, ErrandDefinition definition, String expectedReason) {
        ErrandValidationException ex = assertThrows(ErrandValidationException.class, () -> validator.validate(definition));
        assertEquals(expectedReason, ex.getReasonCode(), label);
        assertTrue(ex.getMessage().startsWith("[" + expectedReason + "]"));
    }

    @Test
    @DisplayName("Well-formed definition passes, including a full-day window")
    void testValid() {
        assertDoesNotThrow(() -> validator.validate(valid().build()));
        assertDoesNotThrow(() -> validator.validate(valid()
                .validWindow(TimeWindow.ofHhmm("0000", "2400"))
                .estimatedDurationMinutes(1440)
                .minimumDurationMinutes(60)
                .build()));
        assertDoesNotThrow(() -> validator.validate(valid()
                .complementaryDefinitionId("laundry")
                .sameDayRequired(true)
                .orderRequired(true)
                .conflictingDefinitionId("ironing")
                .build()));
    }

    @Test
    @DisplayName("Rejections carry the definition id")
    void testDefinitionIdCarried() {
        ErrandValidationException ex = assertThrows(ErrandValidationException.class,
                () -> validator.validate(valid().id("laundry").priority(-3).build()));
        assertEquals("laundry", ex.getDefinitionId());
    }
}
