package org.gopti.planner.solver;

import lombok.Value;

/**
 * One visited event. {@code arrive} is when the event is entered, after any
 * wait for its window to open. All times are seconds from the trip start.
 */
@Value
public class ScheduledVisit {
    int event;
    long travel;
    long wait;
    long arrive;
    long depart;
    long dwell;
    long late;
}
