package org.gopti.planner.travel;

import lombok.Value;

/**
 * One walked leg. {@code path} is an encoded polyline and may be null.
 */
@Value
public class TravelLeg {
    public static final TravelLeg ZERO = new TravelLeg(0, 0.0, null);

    long seconds;
    double meters;
    String path;
}
