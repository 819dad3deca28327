package org.gopti.planner.service;

import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.model.Coordinate;
import org.gopti.planner.model.Event;
import org.gopti.planner.model.ItineraryResponse;
import org.gopti.planner.model.ObjectiveWeights;
import org.gopti.planner.model.TripRequest;
import org.gopti.planner.solver.Deadline;
import org.gopti.planner.solver.FeasibilityPreFilter;
import org.gopti.planner.solver.IPrimarySolver;
import org.gopti.planner.solver.ProblemInstance;
import org.gopti.planner.solver.SolveAttempt;
import org.gopti.planner.solver.SolverBudget;
import org.gopti.planner.solver.fallback.FallbackHeuristic;
import org.gopti.planner.travel.TravelMatrix;
import org.gopti.planner.travel.TravelTimeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class ItineraryService implements IItineraryService {

    private static final Logger logger = LoggerFactory.getLogger(ItineraryService.class);

    private final RequestValidator requestValidator;
    private final FeasibilityPreFilter preFilter;
    private final TravelTimeService travelTimeService;
    private final IPrimarySolver primarySolver;
    private final SolverBudget solverBudget;
    private final FallbackHeuristic fallbackHeuristic;
    private final ResponseBuilder responseBuilder;
    private final PlannerProperties properties;

    @Autowired
    public ItineraryService(
        RequestValidator requestValidator,
        FeasibilityPreFilter preFilter,
        TravelTimeService travelTimeService,
        IPrimarySolver primarySolver,
        SolverBudget solverBudget,
        FallbackHeuristic fallbackHeuristic,
        ResponseBuilder responseBuilder,
        PlannerProperties properties
    ) {
        this.requestValidator = requestValidator;
        this.preFilter = preFilter;
        this.travelTimeService = travelTimeService;
        this.primarySolver = primarySolver;
        this.solverBudget = solverBudget;
        this.fallbackHeuristic = fallbackHeuristic;
        this.responseBuilder = responseBuilder;
        this.properties = properties;
    }

    @Override
    public ItineraryResponse solve(TripRequest request) {
        long startNanos = System.nanoTime();
        requestValidator.validate(request);

        double walkingSpeed = request.getWalkingSpeed() != null
            ? request.getWalkingSpeed()
            : properties.getRequest().getDefaultWalkingSpeed();

        var filtered = preFilter.filter(request, travelTimeService.estimateProvider(walkingSpeed));
        var events = new ArrayList<>(filtered.getKept());
        events.sort(Comparator.comparing(Event::getId));

        var instance = buildInstance(request, events, walkingSpeed);

        SolveAttempt attempt = SolveAttempt.unresolved("primary solver disabled");
        if (!properties.getSolver().isSkipPrimary()) {
            var budget = solverBudget.budgetFor(instance.size());
            attempt = primarySolver.solve(instance, Deadline.after(budget));
        } else {
            logger.warn("DEBUG: Skipping primary solver");
        }

        if (!attempt.isResolved()) {
            logger.info("Primary solver unresolved ({}), running fallback", attempt.getUnresolvedReason());
            attempt = fallbackHeuristic.solve(instance);
        }

        long solveMs = (System.nanoTime() - startNanos) / 1_000_000;
        var response = responseBuilder.build(request, instance, attempt, filtered.getDropped(), solveMs, walkingSpeed);

        logger.info("Solved {} events: stage={}, visited={}, dropped={}, {} ms{}",
            request.getEvents().size(),
            attempt.getStage().code(),
            response.getMetrics().getVisited(),
            response.getMetrics().getDropped(),
            solveMs,
            response.getMetrics().isDegraded() ? " (degraded travel times)" : "");
        return response;
    }

    private ProblemInstance buildInstance(TripRequest request, List<Event> events, double walkingSpeed) {
        var start = request.getStart();
        var points = new ArrayList<Coordinate>();
        var departures = new ArrayList<Instant>();

        points.add(start.getLocation());
        departures.add(start.getTime());
        for (var event : events) {
            points.add(event.getLocation());
            var windowStart = event.getWindow().getStart();
            departures.add(windowStart.isAfter(start.getTime()) ? windowStart : start.getTime());
        }
        if (request.hasFixedEnd()) {
            points.add(request.getEnd());
            departures.add(start.getTime());
        }

        TravelMatrix matrix = travelTimeService.buildMatrix(points, departures, walkingSpeed);

        var weights = request.getWeights() != null ? request.getWeights() : ObjectiveWeights.defaults();
        long horizon = Duration.between(start.getTime(), request.getEndTime()).getSeconds();
        var solverConfig = properties.getSolver();
        long skipPenalty = Math.max(solverConfig.getSkipPenaltyFloor(), horizon * solverConfig.getSkipPenaltyHorizonFactor());

        return new ProblemInstance(
            start.getTime(),
            request.getEndTime(),
            events,
            matrix,
            request.hasFixedEnd(),
            weights,
            solverConfig.getLateToleranceSeconds(),
            skipPenalty
        );
    }
}
