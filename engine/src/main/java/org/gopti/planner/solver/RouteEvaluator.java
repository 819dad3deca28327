package org.gopti.planner.solver;

import java.util.ArrayList;
import java.util.List;

/**
 * Times a visiting order from the trip start, entering every event as early as
 * its window allows.
 */
public final class RouteEvaluator {

    private RouteEvaluator() {
    }

    /**
     * @param order event indices in visiting order
     * @param dwell seconds spent at each event, indexed by event index
     */
    public static Schedule evaluate(ProblemInstance instance, List<Integer> order, long[] dwell) {
        var weights = instance.getWeights();
        var visits = new ArrayList<ScheduledVisit>(order.size());

        var violation = Violation.NONE;
        int violationPosition = -1;
        long violationSeconds = 0;

        long time = 0;
        long totalTravel = 0;
        long totalWait = 0;
        long totalLate = 0;
        double popularity = 0;
        int previous = ProblemInstance.START;

        for (int position = 0; position < order.size(); position++) {
            int event = order.get(position);
            var node = instance.event(event);

            long travel = instance.travel(previous, event);
            long reached = time + travel;
            long arrive = Math.max(reached, node.getWindowStart());
            long wait = arrive - reached;
            long late = Math.max(0, arrive - node.getWindowEnd());

            if (late > instance.getLateTolerance() && violation == Violation.NONE) {
                violation = Violation.WINDOW;
                violationPosition = position;
                violationSeconds = late - instance.getLateTolerance();
            }

            long depart = arrive + dwell[event];
            visits.add(new ScheduledVisit(event, travel, wait, arrive, depart, dwell[event], late));

            totalTravel += travel;
            totalWait += wait;
            totalLate += late;
            popularity += node.getPopularity();
            time = depart;
            previous = event;
        }

        if (!order.isEmpty() && time > instance.getHorizon() && violation == Violation.NONE) {
            violation = Violation.END_BOUND;
            violationPosition = order.size() - 1;
            violationSeconds = time - instance.getHorizon();
        }
        /* A fixed end is walked to even when nothing is visited */
        totalTravel += instance.travelToEnd(previous);

        double objective = totalTravel * weights.getWalk()
            + totalLate * weights.getLatePenalty()
            + totalWait * weights.getWaitPenalty()
            - popularity * weights.getVisitedBonus();

        return new Schedule(visits, violation, violationPosition, violationSeconds,
            totalTravel, totalWait, totalLate, objective);
    }

    public static Schedule empty(ProblemInstance instance) {
        return evaluate(instance, List.of(), new long[instance.size()]);
    }
}
