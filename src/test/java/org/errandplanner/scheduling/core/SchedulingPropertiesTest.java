package org.errandplanner.scheduling.core;

import org.errandplanner.scheduling.model.AccessType;
import org.errandplanner.scheduling.model.BusyEvent;
import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.LocationSpec;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.RepetitionRule;
import org.errandplanner.scheduling.model.TimeWindow;
import org.errandplanner.scheduling.testutil.TableTravelTimeProvider;
import org.errandplanner.scheduling.travel.CalendarProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.errandplanner.scheduling.testutil.PlannerFixtures.HOME;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.OFFICE;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.MONDAY;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.horizon;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Scheduling Property Tests")
class SchedulingPropertiesTest {
    private static final int DAYS = 3;
    private static final List<Place> PLACES = List.of(HOME, OFFICE, Place.named("gym"), Place.named("market"));

    private static List<BusyEvent> randomCalendar(Random random) {
        List<BusyEvent> events = new ArrayList<>();
        for (int day = 0; day < DAYS; day++) {
            int count = random.nextInt(3);
            for (int i = 0; i < count; i++) {
                int startHour = 8 + random.nextInt(11);
                int lengthHours = 1 + random.nextInt(3);
                LocalDate date = MONDAY.plusDays(day);
                BusyEvent.BusyEventBuilder event = BusyEvent.builder()
                        .title("busy-" + day + "-" + i)
                        .start(date.atTime(startHour, 0))
                        .end(date.atTime(startHour, 0).plusHours(lengthHours));
                if (random.nextBoolean()) {
                    event.location(OFFICE);
                }
                events.add(event.build());
            }
        }
        return events;
    }

    private static List<ErrandDefinition> randomDefinitions(Random random) {
        List<ErrandDefinition> definitions = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            int windowStart = (6 + random.nextInt(11)) * 60;
            int windowLength = (2 + random.nextInt(4)) * 60;
            int duration = 15 * (1 + random.nextInt(4));
            ErrandDefinition.ErrandDefinitionBuilder definition = ErrandDefinition.builder()
                    .id("e" + i)
                    .title("errand " + i)
                    .accessType(AccessType.DRIVE)
                    .priority(random.nextInt(4))
                    .estimatedDurationMinutes(duration)
                    .validWindow(TimeWindow.of(windowStart, windowStart + windowLength));
            int location = random.nextInt(PLACES.size() + 1);
            definition.location(location == PLACES.size()
                    ? LocationSpec.remote()
                    : LocationSpec.ofPlace(PLACES.get(location)));
            switch (random.nextInt(3)) {
                case 0 -> definition.repetition(RepetitionRule.none());
                case 1 -> definition.repetition(RepetitionRule.daily());
                default -> definition.repetition(RepetitionRule.weeklyOn(DayOfWeek.of(1 + random.nextInt(7))));
            }
            definitions.add(definition.build());
        }
        return definitions;
    }

    private static SchedulingResult run(List<ErrandDefinition> definitions, List<BusyEvent> calendar) {
        return ErrandPlanner.builder()
                .home(HOME)
                .travelTimeProvider(new TableTravelTimeProvider(15).between("home", "office", 25))
                .config(SchedulerConfig.builder().providerBackoffMillis(0L).build())
                .build()
                .schedule(definitions, horizon(DAYS), CalendarProvider.of(calendar));
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1L, 7L, 42L, 99L, 2024L, 31337L})
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    @DisplayName("Random schedules respect windows, calendar, travel and spacing")
    void testScheduleInvariants(long seed) {
        Random random = new Random(seed);
        List<BusyEvent> calendar = randomCalendar(random);
        List<ErrandDefinition> definitions = randomDefinitions(random);
        Map<String, ErrandDefinition> byId = new HashMap<>();
        for (ErrandDefinition definition : definitions) {
            byId.put(definition.getId(), definition);
        }

        SchedulingResult result = run(definitions, calendar);
        assertTrue(result.getRejectedDefinitions().isEmpty());

        List<ScheduledErrand> placed = result.getPlaced();
        Set<String> definitionDays = new HashSet<>();
        for (int i = 0; i < placed.size(); i++) {
            ScheduledErrand errand = placed.get(i);
            ErrandDefinition definition = byId.get(errand.getDefinitionId());
            TimeWindow window = definition.getValidWindow();
            int startOfDay = errand.getStart().getHour() * 60 + errand.getStart().getMinute();
            long duration = Duration.between(errand.getStart(), errand.getEnd()).toMinutes();

            assertEquals(definition.getEstimatedDurationMinutes(), duration, errand.getInstanceId());
            assertTrue(startOfDay >= window.getStartMinute(), errand.getInstanceId() + " starts before its window");
            assertTrue(startOfDay + duration <= window.getEndMinute(), errand.getInstanceId() + " ends after its window");
            assertTrue(definitionDays.add(errand.getDefinitionId() + "@" + errand.getStart().toLocalDate()),
                    errand.getDefinitionId() + " placed twice on one day");

            for (BusyEvent event : calendar) {
                boolean overlaps = errand.getStart().isBefore(event.getEnd()) && event.getStart().isBefore(errand.getEnd());
                assertFalse(overlaps, errand.getInstanceId() + " overlaps " + event.getTitle());
            }

            if (i > 0) {
                ScheduledErrand previous = placed.get(i - 1);
                long gap = Duration.between(previous.getEnd(), errand.getStart()).toMinutes();
                assertTrue(gap >= 0, errand.getInstanceId() + " overlaps " + previous.getInstanceId());
                if (previous.getStart().toLocalDate().equals(errand.getStart().toLocalDate())) {
                    assertTrue(gap >= errand.getTravel().getDurationMinutes(),
                            "no room to travel from " + previous.getInstanceId() + " to " + errand.getInstanceId());
                }
            }
        }
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {3L, 17L, 256L})
    @DisplayName("Random inputs are planned identically on every run")
    void testDeterminism(long seed) {
        Random random = new Random(seed);
        List<BusyEvent> calendar = randomCalendar(random);
        List<ErrandDefinition> definitions = randomDefinitions(random);

        SchedulingResult first = run(definitions, calendar);
        SchedulingResult second = run(definitions, calendar);

        assertEquals(first.getPlaced(), second.getPlaced());
        assertEquals(first.getUnschedulable(), second.getUnschedulable());
    }
}
