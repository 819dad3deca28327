package org.gopti.planner.solver;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A fully timed visiting order, feasible or not. Built by {@link RouteEvaluator}.
 */
@Getter
public class Schedule {
    private final List<ScheduledVisit> visits;
    private final Violation violation;
    /* Position in visits of the first violation, -1 when feasible */
    private final int violationPosition;
    /* How many seconds too late the violating arrival or departure is */
    private final long violationSeconds;
    private final long totalTravel;
    private final long totalWait;
    private final long totalLate;
    private final double objective;

    Schedule(
        List<ScheduledVisit> visits,
        Violation violation,
        int violationPosition,
        long violationSeconds,
        long totalTravel,
        long totalWait,
        long totalLate,
        double objective
    ) {
        this.visits = List.copyOf(visits);
        this.violation = violation;
        this.violationPosition = violationPosition;
        this.violationSeconds = violationSeconds;
        this.totalTravel = totalTravel;
        this.totalWait = totalWait;
        this.totalLate = totalLate;
        this.objective = objective;
    }

    public boolean isFeasible() {
        return violation == Violation.NONE;
    }

    public boolean isEmpty() {
        return visits.isEmpty();
    }

    public int size() {
        return visits.size();
    }

    public List<Integer> order() {
        return visits.stream().map(ScheduledVisit::getEvent).collect(Collectors.toList());
    }

    public boolean visits(int event) {
        return visits.stream().anyMatch(v -> v.getEvent() == event);
    }

    /* Objective with every unvisited event priced at the skip penalty */
    public double penalizedObjective(ProblemInstance instance) {
        return objective + (double) instance.getSkipPenalty() * (instance.size() - visits.size());
    }

    @Override
    public String toString() {
        return String.format("%s %s travel=%ds wait=%ds", order(), violation, totalTravel, totalWait);
    }
}
