package org.gopti.planner.solver;

import org.gopti.planner.model.Coordinate;
import org.gopti.planner.model.Event;
import org.gopti.planner.model.ObjectiveWeights;
import org.gopti.planner.model.TimeWindow;
import org.gopti.planner.travel.TravelMatrix;

import java.time.Instant;
import java.util.List;

/**
 * Hand-built problem instances with exact travel times.
 */
public final class Fixtures {
    public static final Instant ORIGIN = Instant.parse("2026-06-01T10:00:00Z");

    private Fixtures() {
    }

    public static Event event(String id, long windowStart, long windowEnd, int dwellMin, int dwellMax, double popularity) {
        return Event.builder()
            .id(id)
            .location(new Coordinate(0.0, 0.0))
            .window(new TimeWindow(ORIGIN.plusSeconds(windowStart), ORIGIN.plusSeconds(windowEnd)))
            .dwellMin(dwellMin)
            .dwellMax(dwellMax)
            .popularity(popularity)
            .build();
    }

    /* Every pair of distinct nodes is the same walk apart */
    public static TravelMatrix uniform(int nodes, long seconds) {
        var matrix = new long[nodes][nodes];
        for (int i = 0; i < nodes; i++) {
            for (int j = 0; j < nodes; j++) {
                matrix[i][j] = i == j ? 0 : seconds;
            }
        }
        return of(matrix);
    }

    /* Nodes on a line, node k at position k * step */
    public static TravelMatrix line(int nodes, long step) {
        var matrix = new long[nodes][nodes];
        for (int i = 0; i < nodes; i++) {
            for (int j = 0; j < nodes; j++) {
                matrix[i][j] = Math.abs(i - j) * step;
            }
        }
        return of(matrix);
    }

    public static TravelMatrix of(long[][] seconds) {
        var meters = new double[seconds.length][seconds.length];
        for (int i = 0; i < seconds.length; i++) {
            for (int j = 0; j < seconds.length; j++) {
                meters[i][j] = seconds[i][j] * 1.35;
            }
        }
        return new TravelMatrix(seconds, meters, false, "fixture");
    }

    public static ProblemInstance instance(long horizon, TravelMatrix matrix, boolean fixedEnd, Event... events) {
        return new ProblemInstance(
            ORIGIN,
            ORIGIN.plusSeconds(horizon),
            List.of(events),
            matrix,
            fixedEnd,
            ObjectiveWeights.defaults(),
            0,
            Math.max(3000, horizon * 4)
        );
    }

    /* Two events only reachable together if the first one is shortened */
    public static ProblemInstance dwellCompressionScenario() {
        return instance(6030, uniform(3, 60), false,
            event("A", 0, 7200, 10, 60, 1.0),
            event("B", 1800, 2400, 60, 60, 10.0));
    }

    /* Two events that cannot both fit before the trip ends */
    public static ProblemInstance forcedDropScenario() {
        return instance(3600, uniform(3, 600), false,
            event("A", 0, 3600, 30, 30, 10.0),
            event("B", 0, 3600, 30, 30, 1.0));
    }
}
