package org.gopti.planner.solver;

import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.RoutingSearchParameters;
import com.google.ortools.constraintsolver.main;
import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.model.DropRecord;
import org.gopti.planner.model.SolveStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-agent routing with time windows on the OR-Tools routing solver.
 * <p>
 * Node 0 is the start, nodes 1..n the events and node n+1 the end. An open
 * trip ends at a virtual node reached from anywhere at no cost. Every event
 * sits in its own disjunction so it can be skipped at a penalty. Service time
 * is the event's minimum dwell.
 */
@Service
public class ORToolsPrimarySolver implements IPrimarySolver {

    private static final Logger logger = LoggerFactory.getLogger(ORToolsPrimarySolver.class);

    private static final String TIME_DIMENSION = "time";

    private final PlannerProperties.Solver config;

    @Autowired
    public ORToolsPrimarySolver(PlannerProperties properties) {
        this.config = properties.getSolver();
    }

    @Override
    public SolveAttempt solve(ProblemInstance instance, Deadline deadline) {
        if (instance.size() == 0) {
            return SolveAttempt.resolved(RouteEvaluator.empty(instance), List.of(), SolveStage.PRIMARY);
        }
        if (deadline.isExpired()) {
            return SolveAttempt.unresolved("budget exhausted before search");
        }

        try {
            return search(instance, deadline);
        } catch (RuntimeException | LinkageError ex) {
            logger.warn("Primary search failed: {}", ex.toString());
            return SolveAttempt.unresolved("solver failure: " + ex.getMessage());
        }
    }

    private SolveAttempt search(ProblemInstance instance, Deadline deadline) {
        int eventCount = instance.size();
        int startNode = 0;
        int endNode = eventCount + 1;
        long scale = config.getCostScale();
        long horizon = instance.getHorizon();
        var weights = instance.getWeights();

        var manager = new RoutingIndexManager(eventCount + 2, 1, new int[]{startNode}, new int[]{endNode});
        var routing = new RoutingModel(manager);

        /* Walking cost, including the walk to a fixed end */
        var costCallbackIndex = routing.registerTransitCallback((fromIndex, toIndex) -> {
            var fromNode = manager.indexToNode(fromIndex);
            var toNode = manager.indexToNode(toIndex);
            return Math.round(travel(instance, fromNode, toNode, endNode) * weights.getWalk() * scale);
        });
        routing.setArcCostEvaluatorOfAllVehicles(costCallbackIndex);

        /* Time: dwell at the origin plus the walk; the end bound applies to the last departure */
        var timeCallbackIndex = routing.registerTransitCallback((fromIndex, toIndex) -> {
            var fromNode = manager.indexToNode(fromIndex);
            var toNode = manager.indexToNode(toIndex);
            long dwell = fromNode == startNode || fromNode == endNode ? 0 : instance.event(fromNode - 1).getDwellMin();
            long walk = toNode == endNode ? 0 : travel(instance, fromNode, toNode, endNode);
            return dwell + walk;
        });
        routing.addDimension(
            timeCallbackIndex,
            horizon, /* Allow waiting for windows to open */
            horizon,
            false,
            TIME_DIMENSION
        );
        var timeDimension = routing.getMutableDimension(TIME_DIMENSION);

        /* Span minus travel minus dwell is waiting time */
        timeDimension.setSpanCostCoefficientForAllVehicles(Math.round(weights.getWaitPenalty() * scale));

        timeDimension.cumulVar(routing.start(0)).setRange(0, 0);
        timeDimension.cumulVar(routing.end(0)).setRange(0, horizon);

        long lateCost = Math.round(weights.getLatePenalty() * scale);
        for (var node : instance.getEvents()) {
            long index = manager.nodeToIndex(instance.nodeOf(node.getIndex()));
            long earliest = Math.max(0, node.getWindowStart());
            long latest = Math.min(node.getWindowEnd() + instance.getLateTolerance(), horizon);

            if (earliest > latest) {
                routing.activeVar(index).setMax(0);
            } else {
                timeDimension.cumulVar(index).setRange(earliest, latest);
                if (instance.getLateTolerance() > 0 && node.getWindowEnd() < latest) {
                    timeDimension.setCumulVarSoftUpperBound(index, Math.max(earliest, node.getWindowEnd()), lateCost);
                }
            }

            /* Skipping forfeits the bonus; the dwell term offsets what the span cost charges for visiting */
            double penalty = instance.getSkipPenalty()
                + weights.getVisitedBonus() * node.getPopularity()
                + weights.getWaitPenalty() * node.getDwellMin();
            routing.addDisjunction(new long[]{index}, Math.round(penalty * scale));
        }

        var searchParams = searchParameters(deadline);
        if (deadline.isExpired()) {
            return SolveAttempt.unresolved("budget exhausted while building the model");
        }

        var assignment = routing.solveWithParameters(searchParams);
        if (assignment == null) {
            logger.info("Primary solver found no solution for {} events (status {})", eventCount, routing.status());
            return SolveAttempt.unresolved("no solution within budget");
        }

        return buildAttempt(instance, routing, manager, assignment);
    }

    private static SolveAttempt buildAttempt(
        ProblemInstance instance,
        RoutingModel routing,
        RoutingIndexManager manager,
        Assignment assignment
    ) {
        var order = new ArrayList<Integer>();
        long index = assignment.value(routing.nextVar(routing.start(0)));
        while (!routing.isEnd(index)) {
            order.add(manager.indexToNode(index) - 1);
            index = assignment.value(routing.nextVar(index));
        }

        var schedule = RouteEvaluator.evaluate(instance, order, instance.dwellMinByEvent());
        var problems = ScheduleValidator.validate(instance, schedule);
        if (!schedule.isFeasible() || !problems.isEmpty()) {
            logger.warn("Primary solution rejected: {} {}", schedule, problems);
            return SolveAttempt.unresolved("solution failed validation");
        }

        var drops = new ArrayList<DropRecord>();
        for (var node : instance.getEvents()) {
            if (!schedule.visits(node.getIndex())) {
                drops.add(new DropRecord(node.getId(), DropReasonClassifier.classify(instance, node.getIndex(), schedule)));
            }
        }
        return SolveAttempt.resolved(schedule, drops, SolveStage.PRIMARY);
    }

    private RoutingSearchParameters searchParameters(Deadline deadline) {
        var remaining = deadline.remaining();
        return main.defaultRoutingSearchParameters()
            .toBuilder()
            .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
            .setLocalSearchMetaheuristic(metaheuristic())
            .setTimeLimit(com.google.protobuf.Duration.newBuilder()
                .setSeconds(remaining.getSeconds())
                .setNanos(remaining.getNano())
                .build())
            .build();
    }

    private LocalSearchMetaheuristic.Value metaheuristic() {
        try {
            return LocalSearchMetaheuristic.Value.valueOf(config.getMetaheuristic());
        } catch (IllegalArgumentException | NullPointerException ex) {
            logger.warn("Unknown metaheuristic {}, using GREEDY_DESCENT", config.getMetaheuristic());
            return LocalSearchMetaheuristic.Value.GREEDY_DESCENT;
        }
    }

    private static long travel(ProblemInstance instance, int fromNode, int toNode, int endNode) {
        if (fromNode == endNode || fromNode == toNode) {
            return 0;
        }
        if (toNode == endNode) {
            return instance.travelToEnd(fromNode - 1);
        }
        return instance.travel(fromNode - 1, toNode - 1);
    }
}
