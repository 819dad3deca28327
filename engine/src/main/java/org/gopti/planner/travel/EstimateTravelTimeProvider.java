package org.gopti.planner.travel;

import org.gopti.planner.model.Coordinate;
import org.gopti.planner.util.GeoUtils;
import org.gopti.planner.util.PolylineEncoder;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Straight-line distance walked at a constant speed. Never fails and never
 * overestimates a routed walk, which makes it safe for pruning.
 */
public class EstimateTravelTimeProvider implements ITravelTimeProvider {
    public static final String MODE = "estimate";

    private final double walkingSpeed;

    public EstimateTravelTimeProvider(double walkingSpeed) {
        if (!(walkingSpeed > 0)) {
            throw new IllegalArgumentException("Walking speed must be positive");
        }
        this.walkingSpeed = walkingSpeed;
    }

    @Override
    public String mode() {
        return String.format(Locale.ROOT, "%s@%.3f", MODE, walkingSpeed);
    }

    @Override
    public TravelLeg duration(Coordinate from, Coordinate to, Instant departAt) {
        double meters = GeoUtils.haversine(from, to);
        return new TravelLeg(seconds(meters), meters, PolylineEncoder.encode(List.of(from, to)));
    }

    @Override
    public TravelLeg[][] matrix(List<Coordinate> points, Instant departAt) {
        int size = points.size();
        var result = new TravelLeg[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i == j) {
                    result[i][j] = TravelLeg.ZERO;
                    continue;
                }
                double meters = GeoUtils.haversine(points.get(i), points.get(j));
                result[i][j] = new TravelLeg(seconds(meters), meters, null);
            }
        }
        return result;
    }

    private long seconds(double meters) {
        return (long) (meters / walkingSpeed);
    }
}
