package org.gopti.planner.solver;

import lombok.Value;
import org.gopti.planner.model.Event;

/**
 * An event as the solvers see it: times in seconds relative to the trip start.
 */
@Value
public class EventNode {
    int index;
    Event event;
    long windowStart;
    long windowEnd;
    long dwellMin;
    long dwellMax;

    public String getId() {
        return event.getId();
    }

    public double getPopularity() {
        return event.getPopularity();
    }

    public boolean isBookingRequired() {
        return event.isBookingRequired();
    }
}
