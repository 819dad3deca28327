package org.gopti.planner.solver;

public enum Violation {
    NONE,
    /* An event entered after its window end (plus tolerance) */
    WINDOW,
    /* Departure from the last event after the trip end time */
    END_BOUND
}
