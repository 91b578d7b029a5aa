package org.errandplanner.scheduling.core;

import org.errandplanner.scheduling.ledger.FreeInterval;
import org.errandplanner.scheduling.ledger.FreeTimeLedger;
import org.errandplanner.scheduling.model.BlockingReason;
import org.errandplanner.scheduling.model.BusyEvent;
import org.errandplanner.scheduling.model.ErrandDefinition;
import org.errandplanner.scheduling.model.ErrandInstance;
import org.errandplanner.scheduling.model.LocationSpec;
import org.errandplanner.scheduling.model.Place;
import org.errandplanner.scheduling.model.Placement;
import org.errandplanner.scheduling.state.ScheduleWorkspace;
import org.errandplanner.scheduling.state.WorkspaceConflictException;
import org.errandplanner.scheduling.testutil.TableTravelTimeProvider;
import org.errandplanner.scheduling.travel.TravelGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.errandplanner.scheduling.testutil.PlannerFixtures.HOME;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.MONDAY;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.at;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.horizon;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.minute;
import static org.errandplanner.scheduling.testutil.PlannerFixtures.remote;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CascadeResolver Tests")
class CascadeResolverTest {

    private PlacementSearch search;
    private CascadeResolver resolver;

    @BeforeEach
    void setUp() {
        SchedulerConfig config = SchedulerConfig.builder().build();
        search = new PlacementSearch(
                new TravelGateway(new TableTravelTimeProvider(10), null, 1, 0L), horizon(1), HOME, config, null);
        resolver = new CascadeResolver(search, horizon(1), config);
    }

    /**
     * Workspace with free time only between {@code from} and {@code to} on the first day.
     */
    private static ScheduleWorkspace openBetween(String from, String to) {
        return new ScheduleWorkspace(new FreeTimeLedger(horizon(1), HOME, List.of(
                BusyEvent.located("before", at(0, "0000"), at(0, from), HOME),
                BusyEvent.located("after", at(0, to), at(1, "0000"), HOME))));
    }

    private Placement placeDirectly(ErrandDefinition definition, ScheduleWorkspace workspace) {
        PlacementResult result = search.place(ErrandInstance.onDate(definition, MONDAY), workspace);
        assertTrue(result.isScheduled(), "setup placement failed for " + definition.getId());
        workspace.commit(result.getPlacement());
        return result.getPlacement();
    }

    private static long startOf(ScheduleWorkspace workspace, String definitionId) {
        return workspace.state().get(ErrandInstance.idFor(definitionId, MONDAY)).orElseThrow().getStartMinute();
    }

    @Test
    @DisplayName("Equal-priority neighbour moves later to make room")
    void testSingleHop() {
        ScheduleWorkspace workspace = openBetween("0800", "1200");
        placeDirectly(remote("c", 3, "0800", "1200", 60).build(), workspace);
        ErrandInstance blocked = ErrandInstance.onDate(remote("b", 3, "0830", "0930", 60).build(), MONDAY);
        PlacementResult direct = search.place(blocked, workspace);
        assertFalse(direct.isScheduled());

        CascadeResult result = resolver.resolve(blocked, workspace, direct.getBlockingReason());

        assertTrue(result.isPlaced());
        assertEquals(List.of(ErrandInstance.idFor("c", MONDAY)), result.getDisplacedInstanceIds());
        assertEquals(minute(0, "0830"), startOf(workspace, "b"));
        assertEquals(minute(0, "0930"), startOf(workspace, "c"));
    }

    @Test
    @DisplayName("Two-hop chain moves both neighbours")
    void testTwoHops() {
        ScheduleWorkspace workspace = openBetween("0800", "1100");
        placeDirectly(remote("y", 3, "0800", "1000", 60).build(), workspace);
        placeDirectly(remote("z", 2, "0900", "1100", 60).build(), workspace);
        ErrandInstance blocked = ErrandInstance.onDate(remote("x", 5, "0800", "0900", 60).build(), MONDAY);

        CascadeResult shallow = resolver.resolve(blocked, workspace, BlockingReason.TIME_WINDOW_CONFLICT, 1);
        assertFalse(shallow.isPlaced());

        CascadeResult result = resolver.resolve(blocked, workspace, BlockingReason.TIME_WINDOW_CONFLICT);
        assertTrue(result.isPlaced());
        assertEquals(
                List.of(ErrandInstance.idFor("y", MONDAY), ErrandInstance.idFor("z", MONDAY)),
                result.getDisplacedInstanceIds());
        assertEquals(minute(0, "0800"), startOf(workspace, "x"));
        assertEquals(minute(0, "0900"), startOf(workspace, "y"));
        assertEquals(minute(0, "1000"), startOf(workspace, "z"));
    }

    @Test
    @DisplayName("Failed cascade leaves the workspace untouched")
    void testRollback() {
        ScheduleWorkspace workspace = openBetween("0800", "0900");
        placeDirectly(remote("a", 3, "0800", "0900", 60).build(), workspace);
        List<Placement> placementsBefore = workspace.state().placements();
        List<FreeInterval> intervalsBefore = workspace.ledger().intervals();
        long versionBefore = workspace.version();
        ErrandInstance blocked = ErrandInstance.onDate(remote("b", 3, "0800", "0900", 60).build(), MONDAY);

        CascadeResult result = resolver.resolve(blocked, workspace, BlockingReason.TIME_WINDOW_CONFLICT);

        assertFalse(result.isPlaced());
        assertEquals(BlockingReason.TIME_WINDOW_CONFLICT, result.getBlockingReason());
        assertTrue(result.getDisplacedInstanceIds().isEmpty());
        assertEquals(placementsBefore, workspace.state().placements());
        assertEquals(intervalsBefore, workspace.ledger().intervals());
        assertEquals(versionBefore, workspace.version());
    }

    @Test
    @DisplayName("Higher-priority and pinned placements are never displaced")
    void testProtectedNeighbours() {
        ScheduleWorkspace workspace = openBetween("0800", "1000");
        placeDirectly(remote("important", 5, "0800", "0900", 60).build(), workspace);
        workspace.commit(Placement.builder()
                .instance(ErrandInstance.onDate(remote("pinned", 1, "0900", "1000", 60).build(), MONDAY))
                .startMinute(minute(0, "0900"))
                .endMinute(minute(0, "1000"))
                .location(HOME)
                .pinned(true)
                .build());
        ErrandInstance blocked = ErrandInstance.onDate(remote("low", 3, "0800", "1000", 60).build(), MONDAY);

        assertTrue(resolver.displaceableNeighbours(blocked, workspace.state(), 3, Set.of(blocked.getId())).isEmpty());
        assertFalse(resolver.resolve(blocked, workspace, BlockingReason.TIME_WINDOW_CONFLICT).isPlaced());
    }

    @Test
    @DisplayName("Neighbours touching the window or conflicting are ordered by priority, then distance")
    void testNeighbourOrder() {
        ScheduleWorkspace workspace = openBetween("0800", "1400");
        placeDirectly(remote("near", 2, "0800", "0900", 60).build(), workspace);
        placeDirectly(remote("low", 1, "0900", "1000", 60).build(), workspace);
        placeDirectly(remote("far", 2, "1000", "1100", 60).build(), workspace);
        placeDirectly(remote("away", 2, "1200", "1300", 60).conflictingDefinitionId("target").build(), workspace);
        ErrandInstance target = ErrandInstance.onDate(remote("target", 3, "0800", "0900", 60).build(), MONDAY);

        List<Placement> neighbours = resolver.displaceableNeighbours(target, workspace.state(), 3, Set.of(target.getId()));

        assertEquals(List.of("low", "near", "away"), neighbours.stream().map(Placement::definitionId).toList());
    }

    @Test
    @DisplayName("Errors other than workspace conflicts abort the cascade instead of pruning a branch")
    void testUnexpectedErrorPropagates() {
        ScheduleWorkspace workspace = openBetween("0800", "1200");
        Place bakery = Place.named("bakery");
        workspace.commit(Placement.builder()
                .instance(ErrandInstance.onDate(remote("bread", 3, "0800", "1200", 60)
                        .location(LocationSpec.ofStoreCategory("bakery"))
                        .build(), MONDAY))
                .startMinute(minute(0, "0800"))
                .endMinute(minute(0, "0900"))
                .location(bakery)
                .build());
        long versionBefore = workspace.version();
        ErrandInstance blocked = ErrandInstance.onDate(remote("b", 3, "0800", "0900", 60).build(), MONDAY);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> resolver.resolve(blocked, workspace, BlockingReason.TIME_WINDOW_CONFLICT));

        assertFalse(ex instanceof WorkspaceConflictException);
        assertTrue(ex.getMessage().contains("requires a LocationResolver"));
        assertEquals(versionBefore, workspace.version());
    }
}
