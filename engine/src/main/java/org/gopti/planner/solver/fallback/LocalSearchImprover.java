package org.gopti.planner.solver.fallback;

import org.gopti.planner.solver.ProblemInstance;
import org.gopti.planner.solver.RouteEvaluator;
import org.gopti.planner.solver.Schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * First-improvement descent over 2-opt segment reversals and or-opt single
 * node relocations. A move is taken only if the result stays feasible and
 * lowers the objective.
 */
public class LocalSearchImprover {
    private static final double EPSILON = 1e-9;

    private final int maxIterations;

    public LocalSearchImprover(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public Schedule improve(ProblemInstance instance, Schedule start, long[] dwell) {
        var current = start;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            var next = firstImprovement(instance, current, dwell);
            if (next == null) {
                break;
            }
            current = next;
        }
        return current;
    }

    private static Schedule firstImprovement(ProblemInstance instance, Schedule current, long[] dwell) {
        var order = current.order();
        int size = order.size();

        /* 2-opt */
        for (int i = 0; i < size - 1; i++) {
            for (int j = i + 1; j < size; j++) {
                var trial = new ArrayList<>(order);
                Collections.reverse(trial.subList(i, j + 1));
                var candidate = accept(instance, current, trial, dwell);
                if (candidate != null) {
                    return candidate;
                }
            }
        }

        /* or-opt */
        for (int from = 0; from < size; from++) {
            for (int to = 0; to < size; to++) {
                if (from == to) {
                    continue;
                }
                var trial = new ArrayList<>(order);
                trial.add(to, trial.remove(from));
                var candidate = accept(instance, current, trial, dwell);
                if (candidate != null) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private static Schedule accept(ProblemInstance instance, Schedule current, List<Integer> trial, long[] dwell) {
        var schedule = RouteEvaluator.evaluate(instance, trial, dwell);
        if (schedule.isFeasible() && schedule.getObjective() < current.getObjective() - EPSILON) {
            return schedule;
        }
        return null;
    }
}
