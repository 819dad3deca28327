package org.gopti.planner.solver;

import lombok.Getter;
import org.gopti.planner.model.DropRecord;
import org.gopti.planner.model.SolveStage;

import java.util.List;

/**
 * Either a validated schedule with the drops that go with it, or the
 * unresolved signal that hands control to the next stage.
 */
@Getter
public final class SolveAttempt {
    private final Schedule schedule;
    private final List<DropRecord> drops;
    private final SolveStage stage;
    private final String unresolvedReason;

    private SolveAttempt(Schedule schedule, List<DropRecord> drops, SolveStage stage, String unresolvedReason) {
        this.schedule = schedule;
        this.drops = drops;
        this.stage = stage;
        this.unresolvedReason = unresolvedReason;
    }

    public static SolveAttempt resolved(Schedule schedule, List<DropRecord> drops, SolveStage stage) {
        return new SolveAttempt(schedule, List.copyOf(drops), stage, null);
    }

    public static SolveAttempt unresolved(String reason) {
        return new SolveAttempt(null, List.of(), null, reason);
    }

    public boolean isResolved() {
        return schedule != null;
    }
}
