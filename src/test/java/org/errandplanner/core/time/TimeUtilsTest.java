package org.errandplanner.core.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeUtils Tests")
class TimeUtilsTest {

    @Test
    @DisplayName("HHMM parsing covers midnight, noon and the end-of-day sentinel")
    void testParseHhmm() {
        assertEquals(0, TimeUtils.parseHhmm("0000"));
        assertEquals(7 * 60 + 30, TimeUtils.parseHhmm("0730"));
        assertEquals(12 * 60, TimeUtils.parseHhmm("1200"));
        assertEquals(23 * 60 + 59, TimeUtils.parseHhmm("2359"));
        assertEquals(TimeUtils.MINUTES_PER_DAY, TimeUtils.parseHhmm("2400"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "730", "07:30", "2401", "2500", "0760", "abcd", "-100"})
    @DisplayName("Malformed HHMM strings are rejected")
    void testParseHhmmRejectsMalformed(String raw) {
        assertThrows(IllegalArgumentException.class, () -> TimeUtils.parseHhmm(raw));
    }

    @Test
    @DisplayName("Null HHMM is rejected")
    void testParseHhmmRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> TimeUtils.parseHhmm(null));
    }

    @Test
    @DisplayName("Day arithmetic splits horizon minutes at midnight")
    void testDayArithmetic() {
        assertEquals(0, TimeUtils.dayIndex(0));
        assertEquals(0, TimeUtils.dayIndex(1_439));
        assertEquals(1, TimeUtils.dayIndex(1_440));
        assertEquals(2, TimeUtils.dayIndex(2 * 1_440 + 5));
        assertEquals(5, TimeUtils.minuteOfDay(2 * 1_440 + 5));
        assertEquals(2_880L, TimeUtils.dayStart(2));
        assertEquals(4_320L, TimeUtils.dayEnd(2));
    }

    @Test
    @DisplayName("Formatting renders HH:mm and day-prefixed horizon minutes")
    void testFormatting() {
        assertEquals("07:05", TimeUtils.formatMinuteOfDay(425));
        assertEquals("24:00", TimeUtils.formatMinuteOfDay(1_440));
        assertEquals("d1 08:00", TimeUtils.formatHorizonMinute(1_440 + 480));
    }
}
