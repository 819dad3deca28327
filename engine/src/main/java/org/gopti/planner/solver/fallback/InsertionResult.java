package org.gopti.planner.solver.fallback;

import lombok.Value;
import org.gopti.planner.solver.Schedule;
import org.gopti.planner.solver.Violation;

import java.util.List;
import java.util.Map;

/**
 * Feasible route after an insertion pass, plus the events that found no
 * feasible position and the violation that stopped each of them.
 */
@Value
public class InsertionResult {
    Schedule schedule;
    long[] dwell;
    /* Event index to cause, in the order the events were tried */
    Map<Integer, Violation> deferred;

    public List<Integer> getRoute() {
        return schedule.order();
    }

    public boolean isComplete() {
        return deferred.isEmpty();
    }

    /* True when every deferred event only ever failed on the trip end time */
    public boolean isDeferredByEndBoundOnly() {
        return !deferred.isEmpty() && deferred.values().stream().allMatch(v -> v == Violation.END_BOUND);
    }
}
