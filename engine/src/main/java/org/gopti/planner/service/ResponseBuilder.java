package org.gopti.planner.service;

import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.model.Coordinate;
import org.gopti.planner.model.DropReason;
import org.gopti.planner.model.DropRecord;
import org.gopti.planner.model.ItineraryResponse;
import org.gopti.planner.model.SolveMetrics;
import org.gopti.planner.model.TripRequest;
import org.gopti.planner.model.VisitRecord;
import org.gopti.planner.solver.ProblemInstance;
import org.gopti.planner.solver.SolveAttempt;
import org.gopti.planner.travel.TravelTimeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class ResponseBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ResponseBuilder.class);

    private final TravelTimeService travelTimeService;
    private final PlannerProperties properties;

    @Autowired
    public ResponseBuilder(TravelTimeService travelTimeService, PlannerProperties properties) {
        this.travelTimeService = travelTimeService;
        this.properties = properties;
    }

    /**
     * @param preFiltered events removed before the instance was built
     */
    public ItineraryResponse build(
        TripRequest request,
        ProblemInstance instance,
        SolveAttempt attempt,
        List<DropRecord> preFiltered,
        long solveMs,
        double walkingSpeed
    ) {
        var schedule = attempt.getSchedule();
        var origin = instance.getOrigin();
        boolean includePaths = properties.getResponse().isIncludePaths();

        var route = new ArrayList<VisitRecord>(schedule.size());
        Coordinate previousLocation = request.getStart().getLocation();
        long previousDepart = 0;
        for (var visit : schedule.getVisits()) {
            var event = instance.event(visit.getEvent()).getEvent();
            var record = VisitRecord.builder()
                .eventId(event.getId())
                .arrive(origin.plusSeconds(visit.getArrive()))
                .depart(origin.plusSeconds(visit.getDepart()))
                .dwellSec(visit.getDwell())
                .travelSecFromPrev(visit.getTravel())
                .waitSec(visit.getWait())
                .build();
            if (includePaths) {
                record.setPath(travelTimeService.path(
                    previousLocation, event.getLocation(), origin.plusSeconds(previousDepart), walkingSpeed));
            }
            route.add(record);
            previousLocation = event.getLocation();
            previousDepart = visit.getDepart();
        }

        var dropped = orderedDrops(request, route, preFiltered, attempt.getDrops());

        var metrics = SolveMetrics.builder()
            .totalWalkSec(schedule.getTotalTravel())
            .totalWaitSec(schedule.getTotalWait())
            .visited(route.size())
            .dropped(dropped.size())
            .solveMs(solveMs)
            .stage(attempt.getStage())
            .degraded(instance.getMatrix().isDegraded())
            .provider(instance.getMatrix().getProvider())
            .objective(schedule.getObjective())
            .build();

        return new ItineraryResponse(route, dropped, metrics);
    }

    /* Request order; every event ends up either visited or dropped */
    private static List<DropRecord> orderedDrops(
        TripRequest request,
        List<VisitRecord> route,
        List<DropRecord> preFiltered,
        List<DropRecord> solverDrops
    ) {
        Map<String, DropReason> reasons = new HashMap<>();
        preFiltered.forEach(d -> reasons.put(d.getEventId(), d.getReason()));
        solverDrops.forEach(d -> reasons.put(d.getEventId(), d.getReason()));
        route.forEach(v -> reasons.remove(v.getEventId()));

        var visited = route.stream().map(VisitRecord::getEventId).toList();
        var result = new ArrayList<DropRecord>();
        for (var event : request.getEvents()) {
            if (visited.contains(event.getId())) {
                continue;
            }
            var reason = reasons.get(event.getId());
            if (reason == null) {
                logger.error("Event {} neither visited nor dropped, reporting it as low priority", event.getId());
                reason = DropReason.LOW_PRIORITY;
            }
            result.add(new DropRecord(event.getId(), reason));
        }
        return result;
    }
}
