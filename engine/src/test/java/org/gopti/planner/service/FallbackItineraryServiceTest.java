package org.gopti.planner.service;

import org.gopti.planner.model.DropReason;
import org.gopti.planner.model.SolveStage;
import org.gopti.planner.model.VisitRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.gopti.planner.service.TripRequests.event;
import static org.gopti.planner.service.TripRequests.request;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Same entry point with the primary solver switched off.
 */
@SpringBootTest(properties = "planner.solver.skip-primary=true")
class FallbackItineraryServiceTest {

    @Autowired
    private IItineraryService itineraryService;

    @Test
    void compressesFirstVisitToReachSecondWindow() {
        var request = request(Duration.ofSeconds(6060),
            event("A", 0.0005, 0.0, Duration.ZERO, Duration.ofHours(2), 10, 60, 1.0),
            event("B", -0.0005, 0.0, Duration.ofMinutes(30), Duration.ofMinutes(40), 60, 60, 10.0));

        var response = itineraryService.solve(request);

        assertEquals(SolveStage.FALLBACK_COMPRESSED, response.getMetrics().getStage());
        assertEquals(2, response.getRoute().size());
        var first = response.getRoute().get(0);
        assertEquals("A", first.getEventId());
        assertTrue(first.getDwellSec() >= 600);
        assertTrue(first.getDwellSec() < 3600);
        var second = response.getRoute().get(1);
        assertFalse(second.getArrive().isAfter(request.getEvents().get(1).getWindow().getEnd()));
    }

    @Test
    void dropsLessPopularEventOnEndTime() {
        var request = request(Duration.ofMinutes(90),
            event("north", 0.005, 0.0, 60, 60, 10.0),
            event("south", -0.005, 0.0, 60, 60, 1.0));

        var response = itineraryService.solve(request);

        assertEquals(SolveStage.FALLBACK_DROPPED, response.getMetrics().getStage());
        assertEquals("north", response.getRoute().get(0).getEventId());
        assertEquals(DropReason.TIME_BUDGET_EXCEEDED, response.getDropped().get(0).getReason());
    }

    @Test
    void easyDayResolvesGreedily() {
        var request = request(Duration.ofHours(4),
            event("a", 0.001, 0.0, 10, 20, 2.0),
            event("b", 0.002, 0.0, 10, 20, 1.0));

        var response = itineraryService.solve(request);

        assertEquals(SolveStage.FALLBACK_GREEDY, response.getMetrics().getStage());
        assertEquals(2, response.getMetrics().getVisited());
        /* longest allowed dwell when it fits */
        assertEquals(1200, response.getRoute().get(0).getDwellSec());
    }

    @Test
    void laterEndTimeNeverVisitsFewer() {
        var museum = event("museum", 0.001, 0.0, Duration.ZERO, Duration.ofMinutes(10), 60, 60, 10.0);
        var gallery = event("gallery", -0.001, 0.0, Duration.ZERO, Duration.ofMinutes(10), 90, 90, 5.0);
        var kiosk = event("kiosk", 0.0, 0.002, 10, 10, 1.0);

        var shorter = itineraryService.solve(request(Duration.ofMinutes(80), museum, gallery, kiosk));
        var longer = itineraryService.solve(request(Duration.ofHours(3), museum, gallery, kiosk));

        assertEquals(2, shorter.getMetrics().getVisited());
        assertTrue(longer.getMetrics().getVisited() >= shorter.getMetrics().getVisited());
        assertEquals(List.of("museum", "kiosk"), longer.getRoute().stream().map(VisitRecord::getEventId).toList());
        assertEquals("gallery", longer.getDropped().get(0).getEventId());
    }
}
