package org.gopti.planner.travel;

import org.gopti.planner.model.Coordinate;

import java.time.Instant;
import java.util.List;

public interface ITravelTimeProvider {

    /* Part of every cache key, distinct per provider configuration */
    String mode();

    TravelLeg duration(Coordinate from, Coordinate to, Instant departAt);

    /* Full pairwise matrix, legs carry no path */
    TravelLeg[][] matrix(List<Coordinate> points, Instant departAt);
}
