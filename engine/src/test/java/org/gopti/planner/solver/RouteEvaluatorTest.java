package org.gopti.planner.solver;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.gopti.planner.solver.Fixtures.event;
import static org.gopti.planner.solver.Fixtures.instance;
import static org.junit.jupiter.api.Assertions.*;

class RouteEvaluatorTest {

    @Test
    void waitsForWindowToOpen() {
        var instance = instance(7200, Fixtures.uniform(2, 120), false,
            event("A", 1800, 3600, 10, 20, 1.0));

        var schedule = RouteEvaluator.evaluate(instance, List.of(0), instance.dwellMinByEvent());

        assertTrue(schedule.isFeasible());
        var visit = schedule.getVisits().get(0);
        assertEquals(120, visit.getTravel());
        assertEquals(1680, visit.getWait());
        assertEquals(1800, visit.getArrive());
        assertEquals(2400, visit.getDepart());
        assertEquals(1680, schedule.getTotalWait());
    }

    @Test
    void lateArrivalIsWindowViolation() {
        var instance = instance(7200, Fixtures.uniform(3, 600), false,
            event("A", 0, 7200, 30, 30, 1.0),
            event("B", 0, 1000, 10, 10, 1.0));

        var schedule = RouteEvaluator.evaluate(instance, List.of(0, 1), instance.dwellMinByEvent());

        assertFalse(schedule.isFeasible());
        assertEquals(Violation.WINDOW, schedule.getViolation());
        assertEquals(1, schedule.getViolationPosition());
        /* B reached at 600 + 1800 + 600 */
        assertEquals(2000, schedule.getViolationSeconds());
    }

    @Test
    void departureAfterEndTimeIsEndBoundViolation() {
        var instance = Fixtures.forcedDropScenario();

        var schedule = RouteEvaluator.evaluate(instance, List.of(0, 1), instance.dwellMaxByEvent());

        assertEquals(Violation.END_BOUND, schedule.getViolation());
        assertEquals(1200, schedule.getViolationSeconds());
    }

    @Test
    void fixedEndWalkCountsAsTravelButNotAgainstEndTime() {
        /* start, A, end */
        var matrix = Fixtures.of(new long[][]{
            {0, 100, 500},
            {100, 0, 300},
            {500, 300, 0}
        });
        var instance = instance(700, matrix, true, event("A", 0, 700, 10, 10, 1.0));

        var schedule = RouteEvaluator.evaluate(instance, List.of(0), instance.dwellMinByEvent());

        assertTrue(schedule.isFeasible());
        assertEquals(400, schedule.getTotalTravel());
        assertEquals(700, schedule.getVisits().get(0).getDepart());
    }

    @Test
    void emptyRouteWithFixedEndWalksStraightThere() {
        var matrix = Fixtures.of(new long[][]{
            {0, 100, 500},
            {100, 0, 300},
            {500, 300, 0}
        });
        var instance = instance(700, matrix, true, event("A", 0, 700, 10, 10, 1.0));

        var schedule = RouteEvaluator.empty(instance);

        assertTrue(schedule.isFeasible());
        assertTrue(schedule.isEmpty());
        assertEquals(500, schedule.getTotalTravel());
    }

    @Test
    void objectiveCombinesWeightedTerms() {
        var instance = instance(7200, Fixtures.uniform(2, 100), false,
            event("A", 200, 7200, 10, 10, 5.0));

        var schedule = RouteEvaluator.evaluate(instance, List.of(0), instance.dwellMinByEvent());

        /* 100 travel * 1.0 + 100 wait * 0.3 - 5 popularity * 0.4 */
        assertEquals(128.0, schedule.getObjective(), 1e-9);
        assertEquals(128.0, schedule.penalizedObjective(instance), 1e-9);
        /* Skipping the only event costs the skip penalty, max(3000, 4 * horizon) */
        assertEquals(28800.0, RouteEvaluator.empty(instance).penalizedObjective(instance), 1e-9);
    }
}
