package org.gopti.planner.service;

import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.model.Coordinate;
import org.gopti.planner.model.DropReason;
import org.gopti.planner.model.DropRecord;
import org.gopti.planner.model.SolveStage;
import org.gopti.planner.model.StartPoint;
import org.gopti.planner.model.TripRequest;
import org.gopti.planner.solver.Fixtures;
import org.gopti.planner.solver.ProblemInstance;
import org.gopti.planner.solver.RouteEvaluator;
import org.gopti.planner.solver.SolveAttempt;
import org.gopti.planner.travel.TravelTimeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.gopti.planner.solver.Fixtures.ORIGIN;
import static org.gopti.planner.solver.Fixtures.event;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResponseBuilderTest {

    @Mock
    private TravelTimeService travelTimeService;

    private PlannerProperties properties;
    private ResponseBuilder builder;
    private ProblemInstance instance;
    private TripRequest request;

    @BeforeEach
    void setUp() {
        properties = new PlannerProperties();
        builder = new ResponseBuilder(travelTimeService, properties);

        var a = event("A", 0, 7200, 10, 60, 1.0);
        var b = event("B", 1800, 2400, 60, 60, 10.0);
        var c = event("C", 0, 100, 10, 10, 1.0);
        instance = Fixtures.dwellCompressionScenario();

        request = new TripRequest();
        request.setStart(new StartPoint(new Coordinate(0.0, 0.0), ORIGIN));
        request.setEndTime(ORIGIN.plusSeconds(instance.getHorizon()));
        request.setEvents(new ArrayList<>(List.of(c, b, a)));
    }

    private SolveAttempt compressed() {
        var schedule = RouteEvaluator.evaluate(instance, List.of(0, 1), new long[]{2280, 3600});
        return SolveAttempt.resolved(schedule, List.of(), SolveStage.FALLBACK_COMPRESSED);
    }

    @Test
    void visitsCarryAbsoluteTimes() {
        var response = builder.build(request, instance, compressed(),
            List.of(new DropRecord("C", DropReason.WINDOW_CONFLICT)), 12, 1.35);

        assertEquals(2, response.getRoute().size());
        var first = response.getRoute().get(0);
        assertEquals("A", first.getEventId());
        assertEquals(ORIGIN.plusSeconds(60), first.getArrive());
        assertEquals(ORIGIN.plusSeconds(2340), first.getDepart());
        assertEquals(2280, first.getDwellSec());
        assertEquals(60, first.getTravelSecFromPrev());
        assertNull(first.getPath());

        var second = response.getRoute().get(1);
        assertEquals(ORIGIN.plusSeconds(2400), second.getArrive());
        assertEquals(0, second.getWaitSec());
        verifyNoInteractions(travelTimeService);
    }

    @Test
    void metricsSummariseTheSchedule() {
        var response = builder.build(request, instance, compressed(),
            List.of(new DropRecord("C", DropReason.WINDOW_CONFLICT)), 12, 1.35);

        var metrics = response.getMetrics();
        assertEquals(120, metrics.getTotalWalkSec());
        assertEquals(2, metrics.getVisited());
        assertEquals(1, metrics.getDropped());
        assertEquals(12, metrics.getSolveMs());
        assertEquals(SolveStage.FALLBACK_COMPRESSED, metrics.getStage());
        assertEquals("fixture", metrics.getProvider());
        assertFalse(metrics.isDegraded());
        assertEquals(3, metrics.getVisited() + metrics.getDropped());
    }

    @Test
    void dropsFollowRequestOrderAndNothingGoesMissing() {
        var onlyA = SolveAttempt.resolved(
            RouteEvaluator.evaluate(instance, List.of(0), new long[]{600, 3600}),
            List.of(),
            SolveStage.FALLBACK_DROPPED);

        var response = builder.build(request, instance, onlyA,
            List.of(new DropRecord("C", DropReason.WINDOW_CONFLICT)), 5, 1.35);

        assertEquals(List.of(
            new DropRecord("C", DropReason.WINDOW_CONFLICT),
            new DropRecord("B", DropReason.LOW_PRIORITY)
        ), response.getDropped());
    }

    @Test
    void attachesPathsWhenEnabled() {
        properties.getResponse().setIncludePaths(true);
        when(travelTimeService.path(any(), any(), any(), anyDouble())).thenReturn("encoded");

        var response = builder.build(request, instance, compressed(), List.of(), 5, 1.35);

        assertEquals("encoded", response.getRoute().get(0).getPath());
        assertEquals("encoded", response.getRoute().get(1).getPath());
        verify(travelTimeService, times(2)).path(any(), any(), any(), anyDouble());
    }
}
