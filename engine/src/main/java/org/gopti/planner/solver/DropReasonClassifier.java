package org.gopti.planner.solver;

import org.gopti.planner.model.DropReason;

import java.util.List;

/**
 * Explains why the primary solver left an event out of its schedule.
 */
public final class DropReasonClassifier {

    private DropReasonClassifier() {
    }

    public static DropReason classify(ProblemInstance instance, int event, Schedule schedule) {
        var dwell = instance.dwellMinByEvent();
        var node = instance.event(event);

        if (node.isBookingRequired()) {
            for (var visit : schedule.getVisits()) {
                var other = instance.event(visit.getEvent());
                if (!other.isBookingRequired()) {
                    continue;
                }
                var before = RouteEvaluator.evaluate(instance, List.of(event, other.getIndex()), dwell);
                var after = RouteEvaluator.evaluate(instance, List.of(other.getIndex(), event), dwell);
                if (!before.isFeasible() && !after.isFeasible()) {
                    return DropReason.BOOKING_CONFLICT;
                }
            }
        }

        var alone = RouteEvaluator.evaluate(instance, List.of(event), dwell);
        switch (alone.getViolation()) {
            case END_BOUND:
                return DropReason.TIME_BUDGET_EXCEEDED;
            case WINDOW:
                return DropReason.WINDOW_CONFLICT;
            default:
                return DropReason.LOW_PRIORITY;
        }
    }
}
