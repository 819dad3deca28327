package org.gopti.planner.solver;

import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.model.DropReason;
import org.gopti.planner.model.DropRecord;
import org.gopti.planner.model.Event;
import org.gopti.planner.model.TripRequest;
import org.gopti.planner.travel.ITravelTimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;

/**
 * Removes events no ordering can visit. Travel comes from the straight-line
 * estimate, a lower bound on any walk, so nothing reachable is removed.
 */
@Component
public class FeasibilityPreFilter {

    private static final Logger logger = LoggerFactory.getLogger(FeasibilityPreFilter.class);

    private final PlannerProperties properties;

    @Autowired
    public FeasibilityPreFilter(PlannerProperties properties) {
        this.properties = properties;
    }

    public PreFilterResult filter(TripRequest request, ITravelTimeProvider estimate) {
        var origin = request.getStart().getTime();
        long horizon = Duration.between(origin, request.getEndTime()).getSeconds();
        long tolerance = properties.getSolver().getLateToleranceSeconds();

        var kept = new ArrayList<Event>();
        var dropped = new ArrayList<DropRecord>();

        for (var event : request.getEvents()) {
            long earliest = estimate.duration(request.getStart().getLocation(), event.getLocation(), origin).getSeconds();
            long windowStart = event.getWindow().startSecondsFrom(origin);
            long windowEnd = event.getWindow().endSecondsFrom(origin);
            long dwellMin = event.getDwellMin() * 60L;

            if (earliest > windowEnd + tolerance) {
                logger.debug("Event {} unreachable: earliest arrival {}s after window end {}s", event.getId(), earliest, windowEnd);
                dropped.add(new DropRecord(event.getId(), DropReason.WINDOW_CONFLICT));
            } else if (Math.max(windowStart, earliest) + dwellMin > horizon) {
                logger.debug("Event {} cannot finish before the trip ends", event.getId());
                dropped.add(new DropRecord(event.getId(), DropReason.WINDOW_CONFLICT));
            } else {
                kept.add(event);
            }
        }
        return new PreFilterResult(kept, dropped);
    }
}
