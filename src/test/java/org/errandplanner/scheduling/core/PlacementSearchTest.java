package org.errandplanner.scheduling.core;

import org.errandplanner.scheduling.ledger.FreeTimeLedger;
import org.errandplanner.scheduling.model.AccessType;
import org.errandplanner.scheduling.model.BlockingReason;
import org.errandplanner.scheduling.model.BusyEvent;
import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.ErrandInstance;
import org.errandplanner.scheduling.model.IntervalRange;
import org.errandplanner.scheduling.model.LocationSpec;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.Placement;
import org.errandplanner.scheduling.model.RepetitionRule;
import org.errandplanner.scheduling.model.TravelSegment;
import org.errandplanner.scheduling.state.ScheduleWorkspace;
import org.errandplanner.scheduling.testutil.StubLocationResolver;
import org.errandplanner.scheduling.testutil.TableTravelTimeProvider;
import org.errandplanner.scheduling.travel.TravelEstimate;
import org.errandplanner.scheduling.travel.TravelGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.errandplanner.scheduling.testutil.PlannerFixtures.HOME;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.MONDAY;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.OFFICE;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.at;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.fixed;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.horizon;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.minute;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.remote;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlacementSearch Tests")
class PlacementSearchTest {

    private static final Place LIBRARY = Place.named("library");

    private static ScheduleWorkspace workspace(int days, List<BusyEvent> busy) {
        return new ScheduleWorkspace(new FreeTimeLedger(horizon(days), HOME, busy));
    }

    private static PlacementSearch search(int days, TableTravelTimeProvider provider, StubLocationResolver resolver) {
        return new PlacementSearch(
                new TravelGateway(provider, resolver, 1, 0L),
                horizon(days),
                HOME,
                SchedulerConfig.builder().build(),
                null
        );
    }

    private static PlacementSearch search(int days, TableTravelTimeProvider provider) {
        return search(days, provider, null);
    }

    @Nested
    @DisplayName("Fixed locations")
    class FixedLocationTests {

        @Test
        @DisplayName("Travel from home delays nothing when the window opens later")
        void testTravelBeforeWindow() {
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5).between("home", "library", 20);
            ErrandInstance instance = ErrandInstance.onDate(
                    fixed("books", LIBRARY, AccessType.DRIVE, 3, "0900", "1200", 30).build(), MONDAY);

            PlacementResult result = search(1, provider).place(instance, workspace(1, List.of()));

            assertTrue(result.isScheduled());
            Placement placement = result.getPlacement();
            assertEquals(minute(0, "0900"), placement.getStartMinute());
            assertEquals(20, placement.getTravelIn().getDurationMinutes());
            assertEquals(AccessType.DRIVE, placement.getTravelIn().getAccessType());
            assertEquals(0, placement.getTravelOut().getDurationMinutes(), "nothing follows at end of day");
            assertEquals(LIBRARY, placement.getLocation());
        }

        @Test
        @DisplayName("Travel to the next commitment must fit inside the free interval")
        void testTravelOutToNextEvent() {
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5)
                    .between("home", "library", 20)
                    .between("library", "office", 30);
            ScheduleWorkspace workspace = workspace(1,
                    List.of(BusyEvent.located("meeting", at(0, "1000"), at(0, "1100"), OFFICE)));
            ErrandInstance instance = ErrandInstance.onDate(
                    fixed("books", LIBRARY, AccessType.DRIVE, 3, "0800", "1100", 60).build(), MONDAY);

            Placement placement = search(1, provider).place(instance, workspace).getPlacement();

            assertEquals(minute(0, "0800"), placement.getStartMinute());
            assertEquals(30, placement.getTravelOut().getDurationMinutes());
        }

        @Test
        @DisplayName("Infeasible travel is reported as an access-type problem")
        void testInfeasibleAccess() {
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5).infeasible("home", "library");
            ErrandInstance instance = ErrandInstance.onDate(
                    fixed("books", LIBRARY, AccessType.WALK, 3, "0900", "1000", 30).build(), MONDAY);

            PlacementResult result = search(1, provider).place(instance, workspace(1, List.of()));

            assertFalse(result.isScheduled());
            assertEquals(BlockingReason.ACCESS_TYPE_INFEASIBLE, result.getBlockingReason());
        }

        @Test
        @DisplayName("Leaving an unlocated event costs the home estimate plus the penalty")
        void testOpaqueOriginPenalty() {
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5).between("home", "library", 20);
            ScheduleWorkspace workspace = workspace(1,
                    List.of(BusyEvent.unlocated("call", at(0, "0000"), at(0, "1100"))));
            ErrandInstance instance = ErrandInstance.onDate(
                    fixed("books", LIBRARY, AccessType.DRIVE, 3, "1100", "1400", 30).build(), MONDAY);

            Placement placement = search(1, provider).place(instance, workspace).getPlacement();

            int expectedTravel = 20 + SchedulerConfig.DEFAULT_UNKNOWN_LOCATION_PENALTY_MINUTES;
            assertEquals(expectedTravel, placement.getTravelIn().getDurationMinutes());
            assertEquals(minute(0, "1100") + expectedTravel, placement.getStartMinute());
        }
    }

    @Nested
    @DisplayName("Remote and open locations")
    class FlexibleLocationTests {

        @Test
        @DisplayName("Remote errands start at the window and stay where the user is")
        void testRemote() {
            ScheduleWorkspace workspace = workspace(1,
                    List.of(BusyEvent.located("work", at(0, "0800"), at(0, "1700"), OFFICE)));
            ErrandInstance instance = ErrandInstance.onDate(remote("call", 3, "1700", "2000", 30).build(), MONDAY);

            Placement placement = search(1, new TableTravelTimeProvider(5)).place(instance, workspace).getPlacement();

            assertEquals(minute(0, "1700"), placement.getStartMinute());
            assertEquals(OFFICE, placement.getLocation());
            assertEquals(0, placement.getTravelIn().getDurationMinutes());
        }

        @Test
        @DisplayName("Remote errands after an unlocated event have no known location")
        void testRemoteAfterOpaque() {
            ScheduleWorkspace workspace = workspace(1,
                    List.of(BusyEvent.unlocated("call", at(0, "0900"), at(0, "1000"))));
            ErrandInstance instance = ErrandInstance.onDate(remote("email", 3, "1000", "1100", 30).build(), MONDAY);

            Placement placement = search(1, new TableTravelTimeProvider(5)).place(instance, workspace).getPlacement();

            assertEquals(minute(0, "1000"), placement.getStartMinute());
            assertNull(placement.getLocation());
        }

        @Test
        @DisplayName("Store category picks the branch with the least added travel")
        void testNearestBranch() {
            Place near = Place.named("pharmacy near");
            Place far = Place.named("pharmacy far");
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5)
                    .between("home", "pharmacy near", 10)
                    .between("home", "pharmacy far", 25);
            StubLocationResolver resolver = new StubLocationResolver()
                    .branch("pharmacy", far)
                    .branch("pharmacy", near);
            ErrandDefinition definition = remote("meds", 3, "0900", "1200", 15)
                    .location(LocationSpec.ofStoreCategory("pharmacy"))
                    .build();

            Placement placement = search(1, provider, resolver)
                    .place(ErrandInstance.onDate(definition, MONDAY), workspace(1, List.of()))
                    .getPlacement();

            assertEquals(near, placement.getLocation());
            assertEquals(10, placement.getTravelIn().getDurationMinutes());
        }

        @Test
        @DisplayName("Transit trips with fewer line changes win on equal travel")
        void testTransitTransfers() {
            Place direct = Place.named("z direct");
            Place changes = Place.named("a changes");
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5)
                    .between("home", "z direct", TravelEstimate.feasible(20, 0))
                    .between("home", "a changes", TravelEstimate.feasible(20, 2));
            StubLocationResolver resolver = new StubLocationResolver()
                    .branch("grocery", changes)
                    .branch("grocery", direct);
            ErrandDefinition definition = remote("groceries", 3, "0900", "1200", 30)
                    .location(LocationSpec.ofStoreCategory("grocery"))
                    .accessType(AccessType.BUS)
                    .build();

            Placement placement = search(1, provider, resolver)
                    .place(ErrandInstance.onDate(definition, MONDAY), workspace(1, List.of()))
                    .getPlacement();

            assertEquals(direct, placement.getLocation());
        }

        @Test
        @DisplayName("Open-location budget counts travel time before a later window start")
        void testOpenBudgetBeforeWindow() {
            Place store = Place.named("hardware store");
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5).between("home", "hardware store", 20);
            StubLocationResolver resolver = new StubLocationResolver().branch("hardware", store, 20);
            ErrandDefinition definition = remote("screws", 3, "0700", "0800", 60)
                    .location(LocationSpec.ofStoreCategory("hardware"))
                    .build();

            PlacementResult result = search(1, provider, resolver)
                    .place(ErrandInstance.onDate(definition, MONDAY), workspace(1, List.of()));

            assertTrue(result.isScheduled());
            assertEquals(minute(0, "0700"), result.getPlacement().getStartMinute());
            assertEquals(store, result.getPlacement().getLocation());
            assertEquals(20, result.getPlacement().getTravelIn().getDurationMinutes());
            assertEquals(420, resolver.budgets().get(0), "free from midnight to the window end, minus the errand");
        }

        @Test
        @DisplayName("Resolver is asked with the interval origin and drops branches beyond the budget")
        void testResolverBudgetFilter() {
            Place near = Place.named("shop near");
            Place far = Place.named("shop far");
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5)
                    .between("home", "shop near", 10)
                    .between("home", "shop far", 5);
            StubLocationResolver resolver = new StubLocationResolver()
                    .branch("shoes", far, 45)
                    .branch("shoes", near, 25);
            ScheduleWorkspace workspace = workspace(1, List.of(
                    BusyEvent.located("night", at(0, "0000"), at(0, "0800"), HOME),
                    BusyEvent.located("day", at(0, "0930"), at(1, "0000"), HOME)));
            ErrandDefinition definition = remote("laces", 3, "0800", "0930", 60)
                    .location(LocationSpec.ofStoreCategory("shoes"))
                    .build();

            Placement placement = search(1, provider, resolver)
                    .place(ErrandInstance.onDate(definition, MONDAY), workspace)
                    .getPlacement();

            assertEquals(near, placement.getLocation());
            assertEquals(List.of(30), resolver.budgets());
            assertEquals(List.of(HOME), resolver.origins());
        }

        @Test
        @DisplayName("Store category without branches cannot be reached")
        void testNoBranches() {
            ErrandDefinition definition = remote("bakery", 3, "0900", "1200", 30)
                    .location(LocationSpec.ofStoreCategory("bakery"))
                    .build();

            PlacementResult result = search(1, new TableTravelTimeProvider(5), new StubLocationResolver())
                    .place(ErrandInstance.onDate(definition, MONDAY), workspace(1, List.of()));

            assertEquals(BlockingReason.ACCESS_TYPE_INFEASIBLE, result.getBlockingReason());
        }
    }

    @Nested
    @DisplayName("Date screening and fallbacks")
    class ScreeningTests {

        @Test
        @DisplayName("No allowed weekday in range is a time-window conflict")
        void testAllowedDays() {
            ErrandDefinition definition = remote("gym", 3, "0900", "1200", 30)
                    .repetition(RepetitionRule.weeklyOn(DayOfWeek.SUNDAY))
                    .build();
            ErrandInstance instance = ErrandInstance.of(definition, MONDAY, MONDAY, MONDAY.plusDays(2));

            PlacementSearch.DateScreen screen = search(3, new TableTravelTimeProvider(5))
                    .screenDates(instance, workspace(3, List.of()).state());

            assertTrue(screen.dates().isEmpty());
            assertEquals(BlockingReason.TIME_WINDOW_CONFLICT, screen.reason());
        }

        @Test
        @DisplayName("Dates too close to a sibling are a spacing conflict")
        void testSpacing() {
            ErrandDefinition definition = remote("water", 3, "0900", "1200", 30)
                    .intervalRange(IntervalRange.minimumGap(3))
                    .build();
            PlacementSearch search = search(3, new TableTravelTimeProvider(5));
            ScheduleWorkspace workspace = workspace(3, List.of());
            ErrandInstance first = ErrandInstance.onDate(definition, MONDAY);
            workspace.commit(search.place(first, workspace).getPlacement());

            ErrandInstance second = ErrandInstance.of(definition, MONDAY.plusDays(2), MONDAY.plusDays(1), MONDAY.plusDays(2));
            PlacementResult result = search.place(second, workspace);

            assertEquals(BlockingReason.INTERVAL_SPACING_CONFLICT, result.getBlockingReason());
        }

        @Test
        @DisplayName("Days holding a conflicting errand are skipped in both directions")
        void testConflictingDefinitions() {
            ErrandDefinition laundry = remote("laundry", 3, "0900", "1000", 30).conflictingDefinitionId("ironing").build();
            ErrandDefinition ironing = remote("ironing", 3, "1400", "1500", 30).build();
            PlacementSearch search = search(2, new TableTravelTimeProvider(5));
            ScheduleWorkspace workspace = workspace(2, List.of());
            workspace.commit(search.place(ErrandInstance.onDate(laundry, MONDAY), workspace).getPlacement());

            PlacementResult sameDay = search.place(ErrandInstance.onDate(ironing, MONDAY), workspace);
            assertEquals(BlockingReason.CONFLICTING_ERRAND, sameDay.getBlockingReason());

            PlacementResult later = search.place(
                    ErrandInstance.of(ironing, MONDAY, MONDAY, MONDAY.plusDays(1)), workspace);
            assertEquals(minute(1, "1400"), later.getPlacement().getStartMinute());
        }

        @Test
        @DisplayName("Minimum duration is used when the full duration fits nowhere")
        void testMinimumDuration() {
            ScheduleWorkspace workspace = workspace(1, List.of(
                    BusyEvent.located("sleep", at(0, "0000"), at(0, "0800"), HOME),
                    BusyEvent.located("day", at(0, "0830"), at(1, "0000"), HOME)));
            ErrandDefinition definition = remote("tidy", 3, "0800", "1200", 60).minimumDurationMinutes(30).build();

            Placement placement = search(1, new TableTravelTimeProvider(5))
                    .place(ErrandInstance.onDate(definition, MONDAY), workspace)
                    .getPlacement();

            assertEquals(30L, placement.durationMinutes());
            assertEquals(minute(0, "0800"), placement.getStartMinute());
        }

        @Test
        @DisplayName("Executor-backed evaluation returns the inline answer")
        void testExecutorMatchesInline() {
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5)
                    .between("home", "library", 20)
                    .between("office", "library", 5);
            List<BusyEvent> busy = List.of(
                    BusyEvent.located("work", at(0, "0800"), at(0, "1200"), OFFICE),
                    BusyEvent.located("work", at(1, "0800"), at(1, "1200"), OFFICE));
            ErrandDefinition definition = fixed("books", LIBRARY, AccessType.DRIVE, 3, "0700", "1900", 30).build();
            ErrandInstance instance = ErrandInstance.of(definition, MONDAY, MONDAY, MONDAY.plusDays(1));

            Placement inline = search(2, provider).place(instance, workspace(2, busy)).getPlacement();
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                PlacementSearch concurrent = new PlacementSearch(
                        new TravelGateway(provider, null, 1, 0L), horizon(2), HOME, SchedulerConfig.builder().build(), executor);
                assertEquals(inline, concurrent.place(instance, workspace(2, busy)).getPlacement());
            } finally {
                executor.shutdownNow();
            }
            assertEquals(minute(0, "1205"), inline.getStartMinute());
        }
    }

    @Nested
    @DisplayName("Complementary errands")
    class ComplementaryTests {

        @Test
        @DisplayName("Same-day pairing lands on the partner's day")
        void testSameDay() {
            ErrandDefinition laundry = remote("laundry", 3, "0900", "1000", 30).build();
            ErrandDefinition folding = remote("folding", 3, "1400", "1500", 30)
                    .complementaryDefinitionId("laundry")
                    .sameDayRequired(true)
                    .build();
            PlacementSearch search = search(2, new TableTravelTimeProvider(5));
            ScheduleWorkspace workspace = workspace(2, List.of());
            workspace.commit(search.place(ErrandInstance.onDate(laundry, MONDAY.plusDays(1)), workspace).getPlacement());

            PlacementResult result = search.place(
                    ErrandInstance.of(folding, MONDAY, MONDAY, MONDAY.plusDays(1)), workspace);

            assertEquals(minute(1, "1400"), result.getPlacement().getStartMinute());
        }

        @Test
        @DisplayName("Same-day pairing fails when the partner's day is otherwise excluded")
        void testSameDayUnavailable() {
            ErrandDefinition laundry = remote("laundry", 3, "0900", "1000", 30).build();
            ErrandDefinition ironing = remote("ironing", 3, "1100", "1200", 30).build();
            ErrandDefinition folding = remote("folding", 3, "1400", "1500", 30)
                    .complementaryDefinitionId("laundry")
                    .sameDayRequired(true)
                    .conflictingDefinitionId("ironing")
                    .build();
            PlacementSearch search = search(2, new TableTravelTimeProvider(5));
            ScheduleWorkspace workspace = workspace(2, List.of());
            workspace.commit(search.place(ErrandInstance.onDate(laundry, MONDAY.plusDays(1)), workspace).getPlacement());
            workspace.commit(search.place(ErrandInstance.onDate(ironing, MONDAY.plusDays(1)), workspace).getPlacement());

            PlacementResult result = search.place(
                    ErrandInstance.of(folding, MONDAY, MONDAY, MONDAY.plusDays(1)), workspace);

            assertFalse(result.isScheduled());
            assertEquals(BlockingReason.COMPLEMENTARY_REQUIREMENT, result.getBlockingReason());
        }

        @Test
        @DisplayName("Ordered pairing starts after the partner ends")
        void testOrder() {
            ErrandDefinition wash = remote("wash", 3, "0900", "1200", 60).build();
            ErrandDefinition dry = remote("dry", 3, "0800", "1200", 30)
                    .complementaryDefinitionId("wash")
                    .orderRequired(true)
                    .build();
            ErrandDefinition sweep = remote("sweep", 3, "0800", "1200", 30).build();
            PlacementSearch search = search(1, new TableTravelTimeProvider(5));
            ScheduleWorkspace workspace = workspace(1, List.of());
            workspace.commit(search.place(ErrandInstance.onDate(wash, MONDAY), workspace).getPlacement());

            assertEquals(minute(0, "1000"),
                    search.place(ErrandInstance.onDate(dry, MONDAY), workspace).getPlacement().getStartMinute());
            assertEquals(minute(0, "0800"),
                    search.place(ErrandInstance.onDate(sweep, MONDAY), workspace).getPlacement().getStartMinute());
        }

        @Test
        @DisplayName("Same-location pairing prefers the partner's branch over a nearer one")
        void testSameLocation() {
            Place nearPost = Place.named("post near");
            Place farPost = Place.named("post far");
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5)
                    .between("home", "post near", 10)
                    .between("home", "post far", 25);
            StubLocationResolver resolver = new StubLocationResolver()
                    .branch("post", nearPost)
                    .branch("post", farPost);
            ScheduleWorkspace workspace = workspace(1,
                    List.of(BusyEvent.located("work", at(0, "0900"), at(0, "1100"), HOME)));
            PlacementSearch search = search(1, provider, resolver);
            ErrandDefinition stamps = fixed("stamps", farPost, AccessType.DRIVE, 3, "0800", "0900", 30).build();
            workspace.commit(search.place(ErrandInstance.onDate(stamps, MONDAY), workspace).getPlacement());

            ErrandDefinition returns = remote("returns", 3, "1100", "1300", 15)
                    .location(LocationSpec.ofStoreCategory("post"))
                    .complementaryDefinitionId("stamps")
                    .sameLocationRequired(true)
                    .build();
            ErrandDefinition parcel = remote("parcel", 3, "1100", "1300", 15)
                    .location(LocationSpec.ofStoreCategory("post"))
                    .build();

            assertEquals(farPost,
                    search.place(ErrandInstance.onDate(returns, MONDAY), workspace).getPlacement().getLocation());
            assertEquals(nearPost,
                    search.place(ErrandInstance.onDate(parcel, MONDAY), workspace).getPlacement().getLocation());
        }
    }

    @Nested
    @DisplayName("Travel refresh after a withdrawal")
    class RefreshTests {

        private Placement books;
        private Placement call;
        private Placement prep;

        /**
         * Books at the library from 09:00, a remote call right after it (so at the library),
         * then prep at the office from 10:40 with ten minutes of travel.
         */
        private ScheduleWorkspace libraryMorning() {
            ScheduleWorkspace workspace = workspace(1, List.of());
            books = Placement.builder()
                    .instance(ErrandInstance.onDate(fixed("books", LIBRARY, AccessType.DRIVE, 3, "0900", "1000", 60).build(), MONDAY))
                    .startMinute(minute(0, "0900"))
                    .endMinute(minute(0, "1000"))
                    .location(LIBRARY)
                    .travelIn(TravelSegment.of(20, AccessType.DRIVE))
                    .build();
            call = Placement.builder()
                    .instance(ErrandInstance.onDate(remote("call", 3, "1000", "1100", 30).build(), MONDAY))
                    .startMinute(minute(0, "1000"))
                    .endMinute(minute(0, "1030"))
                    .location(LIBRARY)
                    .travelOut(TravelSegment.of(10, AccessType.DRIVE))
                    .build();
            prep = Placement.builder()
                    .instance(ErrandInstance.onDate(fixed("prep", OFFICE, AccessType.DRIVE, 3, "1000", "1200", 50).build(), MONDAY))
                    .startMinute(minute(0, "1040"))
                    .endMinute(minute(0, "1130"))
                    .location(OFFICE)
                    .travelIn(TravelSegment.of(10, AccessType.DRIVE))
                    .build();
            workspace.commit(books);
            workspace.commit(call);
            workspace.commit(prep);
            return workspace;
        }

        @Test
        @DisplayName("Remote successor moves home and the next trip is re-timed from there")
        void testRemoteSuccessorRelocated() {
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5)
                    .between("home", "library", 20)
                    .between("library", "office", 10)
                    .between("home", "office", 8);
            ScheduleWorkspace workspace = libraryMorning();
            Placement withdrawn = workspace.withdraw(books.instanceId()).orElseThrow();

            assertTrue(search(1, provider).refreshTravelAfter(workspace, withdrawn));

            Placement movedCall = workspace.state().get(call.instanceId()).orElseThrow();
            assertEquals(HOME, movedCall.getLocation());
            assertEquals(call.getStartMinute(), movedCall.getStartMinute());
            assertEquals(8, movedCall.getTravelOut().getDurationMinutes());
            assertEquals(8, workspace.state().get(prep.instanceId()).orElseThrow().getTravelIn().getDurationMinutes());
        }

        @Test
        @DisplayName("Remote successor that can no longer reach the next trip fails the refresh")
        void testRemoteSuccessorStranded() {
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5)
                    .between("home", "library", 20)
                    .between("library", "office", 10)
                    .between("home", "office", 60);
            ScheduleWorkspace workspace = libraryMorning();
            Placement withdrawn = workspace.withdraw(books.instanceId()).orElseThrow();

            assertFalse(search(1, provider).refreshTravelAfter(workspace, withdrawn));
        }

        @Test
        @DisplayName("Located successor gets its travel-in from the new origin")
        void testLocatedSuccessor() {
            TableTravelTimeProvider provider = new TableTravelTimeProvider(5).between("home", "office", 30);
            ScheduleWorkspace workspace = libraryMorning();
            workspace.withdraw(books.instanceId()).orElseThrow();
            Placement withdrawn = workspace.withdraw(call.instanceId()).orElseThrow();

            assertTrue(search(1, provider).refreshTravelAfter(workspace, withdrawn));
            assertEquals(30, workspace.state().get(prep.instanceId()).orElseThrow().getTravelIn().getDurationMinutes());
        }
    }
}
