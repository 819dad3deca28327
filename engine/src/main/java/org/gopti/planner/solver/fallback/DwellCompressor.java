package org.gopti.planner.solver.fallback;

import lombok.Value;
import org.gopti.planner.solver.ProblemInstance;
import org.gopti.planner.solver.RouteEvaluator;
import org.gopti.planner.solver.Schedule;
import org.gopti.planner.solver.Violation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Shortens dwell times toward their minimum, latest visits first, until a
 * route fits its windows and the trip end time.
 */
public final class DwellCompressor {

    private DwellCompressor() {
    }

    @Value
    public static class Compression {
        Schedule schedule;
        long[] dwell;

        public boolean isFeasible() {
            return schedule.isFeasible();
        }
    }

    /**
     * Compresses a copy of {@code dwell}. Only visits before a late arrival can
     * pull it earlier; an overrun of the end time can use every visit.
     */
    public static Compression compress(ProblemInstance instance, List<Integer> route, long[] dwell) {
        var compressed = dwell.clone();

        while (true) {
            var schedule = RouteEvaluator.evaluate(instance, route, compressed);
            if (schedule.isFeasible()) {
                return new Compression(schedule, compressed);
            }

            int limit = schedule.getViolation() == Violation.WINDOW
                ? schedule.getViolationPosition()
                : route.size();
            long needed = schedule.getViolationSeconds();
            boolean progressed = false;

            for (int position = limit - 1; position >= 0 && needed > 0; position--) {
                int event = route.get(position);
                long slack = compressed[event] - instance.event(event).getDwellMin();
                if (slack <= 0) {
                    continue;
                }
                long cut = Math.min(slack, needed);
                compressed[event] -= cut;
                needed -= cut;
                progressed = true;
            }

            if (!progressed) {
                return new Compression(schedule, compressed);
            }
        }
    }

    /**
     * Like {@link GreedyInsertion#extend} but each trial route may compress
     * dwell times to make room.
     */
    public static InsertionResult insertCompressing(
        ProblemInstance instance,
        Schedule base,
        long[] dwell,
        List<Integer> candidates
    ) {
        var current = new Compression(base, dwell);
        var deferred = new LinkedHashMap<Integer, Violation>();

        for (int event : candidates) {
            Compression best = null;
            boolean windowFailure = false;

            for (int position = 0; position <= current.getSchedule().size(); position++) {
                var trial = new ArrayList<>(current.getSchedule().order());
                trial.add(position, event);
                var compression = compress(instance, trial, current.getDwell());

                if (!compression.isFeasible()) {
                    windowFailure |= compression.getSchedule().getViolation() == Violation.WINDOW;
                    continue;
                }
                if (best == null || compression.getSchedule().getTotalTravel() < best.getSchedule().getTotalTravel()) {
                    best = compression;
                }
            }

            if (best != null) {
                current = best;
            } else {
                deferred.put(event, windowFailure ? Violation.WINDOW : Violation.END_BOUND);
            }
        }
        return new InsertionResult(current.getSchedule(), current.getDwell(), deferred);
    }
}
