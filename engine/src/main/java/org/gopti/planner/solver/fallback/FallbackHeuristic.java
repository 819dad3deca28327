package org.gopti.planner.solver.fallback;

import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.model.DropReason;
import org.gopti.planner.model.DropRecord;
import org.gopti.planner.model.SolveStage;
import org.gopti.planner.solver.ProblemInstance;
import org.gopti.planner.solver.ScheduleValidator;
import org.gopti.planner.solver.SolveAttempt;
import org.gopti.planner.solver.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Best-effort itinerary when the primary solver is unresolved. Starts cold
 * from the filtered events and escalates: greedy insertion, local search,
 * dwell compression, then dropping the least popular of the events that
 * still found no place and starting over.
 * The empty schedule is always feasible, so this always resolves.
 */
@Service
public class FallbackHeuristic {

    private static final Logger logger = LoggerFactory.getLogger(FallbackHeuristic.class);

    private final LocalSearchImprover improver;

    @Autowired
    public FallbackHeuristic(PlannerProperties properties) {
        this.improver = new LocalSearchImprover(properties.getFallback().getLocalSearchMaxIterations());
    }

    public SolveAttempt solve(ProblemInstance instance) {
        var candidates = IntStream.range(0, instance.size()).boxed().collect(Collectors.toList());
        var drops = new ArrayList<DropRecord>();

        while (true) {
            var outcome = runStages(instance, candidates);
            var attempt = outcome.attempt;
            if (attempt.isResolved()) {
                var stage = drops.isEmpty() ? attempt.getStage() : SolveStage.FALLBACK_DROPPED;
                logger.debug("Fallback resolved at {} with {} visits, {} dropped", stage.code(), attempt.getSchedule().size(), drops.size());
                return SolveAttempt.resolved(attempt.getSchedule(), drops, stage);
            }

            /* Only events that found no place compete for removal */
            var pool = outcome.deferred.isEmpty() ? candidates : new ArrayList<>(outcome.deferred.keySet());
            int victim = leastPopular(instance, pool);
            var reason = outcome.deferred.get(victim) == Violation.END_BOUND
                ? DropReason.TIME_BUDGET_EXCEEDED
                : DropReason.LOW_PRIORITY;
            logger.debug("Fallback dropping {} ({})", instance.event(victim).getId(), reason.code());

            candidates.remove(Integer.valueOf(victim));
            drops.add(new DropRecord(instance.event(victim).getId(), reason));
        }
    }

    private StageOutcome runStages(ProblemInstance instance, List<Integer> candidates) {
        var ordered = GreedyInsertion.priorityOrder(instance, candidates);
        var dwell = instance.dwellMaxByEvent();

        /* Stage 1 */
        var greedy = GreedyInsertion.run(instance, ordered, dwell);
        if (greedy.isComplete()) {
            return accept(instance, greedy, SolveStage.FALLBACK_GREEDY);
        }
        logger.debug("Greedy insertion deferred {}", greedy.getDeferred().keySet());

        /* Stage 2 */
        var improved = improver.improve(instance, greedy.getSchedule(), dwell);
        var retried = GreedyInsertion.extend(instance, improved, dwell, new ArrayList<>(greedy.getDeferred().keySet()));
        if (retried.isComplete()) {
            return accept(instance, retried, SolveStage.FALLBACK_LOCAL_SEARCH);
        }
        logger.debug("Local search left {} deferred", retried.getDeferred().keySet());

        /* Stage 3 */
        var compressed = DwellCompressor.insertCompressing(
            instance, retried.getSchedule(), retried.getDwell(), new ArrayList<>(retried.getDeferred().keySet()));
        if (compressed.isComplete()) {
            return accept(instance, compressed, SolveStage.FALLBACK_COMPRESSED);
        }
        logger.debug("Dwell compression left {} deferred", compressed.getDeferred().keySet());

        return new StageOutcome(SolveAttempt.unresolved("deferred events remain"), compressed.getDeferred());
    }

    private static StageOutcome accept(ProblemInstance instance, InsertionResult result, SolveStage stage) {
        var schedule = result.getSchedule();
        var problems = ScheduleValidator.validate(instance, schedule);
        if (!schedule.isFeasible() || !problems.isEmpty()) {
            logger.error("Fallback stage {} produced an invalid schedule {}: {}", stage.code(), schedule, problems);
            return new StageOutcome(SolveAttempt.unresolved("invalid schedule"), Map.of());
        }
        return new StageOutcome(SolveAttempt.resolved(schedule, List.of(), stage), Map.of());
    }

    /* Lowest popularity, ties to the greatest id */
    private static int leastPopular(ProblemInstance instance, List<Integer> candidates) {
        return candidates.stream()
            .min(Comparator
                .comparingDouble((Integer e) -> instance.event(e).getPopularity())
                .thenComparing((Integer e) -> instance.event(e).getId(), Comparator.reverseOrder()))
            .orElseThrow();
    }

    private static final class StageOutcome {
        private final SolveAttempt attempt;
        /* Events still without a feasible position, with the violation that stopped each */
        private final Map<Integer, Violation> deferred;

        private StageOutcome(SolveAttempt attempt, Map<Integer, Violation> deferred) {
            this.attempt = attempt;
            this.deferred = deferred;
        }
    }
}
