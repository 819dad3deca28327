package org.gopti.planner.solver.fallback;

import org.gopti.planner.solver.ProblemInstance;
import org.gopti.planner.solver.RouteEvaluator;
import org.gopti.planner.solver.Schedule;
import org.gopti.planner.solver.Violation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cheapest feasible insertion. Each candidate goes where it adds the least
 * walking while every visit stays inside its window; ties keep the earliest
 * position. Candidates with no feasible position are deferred.
 */
public final class GreedyInsertion {

    private GreedyInsertion() {
    }

    /* Popularity descending, then id ascending */
    public static List<Integer> priorityOrder(ProblemInstance instance, Collection<Integer> events) {
        return events.stream()
            .sorted(Comparator
                .comparingDouble((Integer e) -> -instance.event(e).getPopularity())
                .thenComparing(e -> instance.event(e).getId()))
            .collect(Collectors.toList());
    }

    public static InsertionResult run(ProblemInstance instance, List<Integer> candidates, long[] dwell) {
        return extend(instance, RouteEvaluator.evaluate(instance, List.of(), dwell), dwell, candidates);
    }

    /**
     * Inserts {@code candidates}, in the given order, into a feasible schedule.
     */
    public static InsertionResult extend(ProblemInstance instance, Schedule base, long[] dwell, List<Integer> candidates) {
        var current = base;
        var deferred = new LinkedHashMap<Integer, Violation>();

        for (int event : candidates) {
            Schedule best = null;
            boolean windowFailure = false;

            for (int position = 0; position <= current.size(); position++) {
                var trial = new ArrayList<>(current.order());
                trial.add(position, event);
                var schedule = RouteEvaluator.evaluate(instance, trial, dwell);

                if (!schedule.isFeasible()) {
                    windowFailure |= schedule.getViolation() == Violation.WINDOW;
                    continue;
                }
                if (best == null || schedule.getTotalTravel() < best.getTotalTravel()) {
                    best = schedule;
                }
            }

            if (best != null) {
                current = best;
            } else {
                deferred.put(event, windowFailure ? Violation.WINDOW : Violation.END_BOUND);
            }
        }
        return new InsertionResult(current, dwell, deferred);
    }
}
