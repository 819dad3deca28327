package org.gopti.planner.util;

import org.gopti.planner.model.Coordinate;

public class GeoUtils {
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    /* Great-circle distance in meters */
    public static double haversine(Coordinate from, Coordinate to) {
        double lat1 = Math.toRadians(from.getLatitude());
        double lat2 = Math.toRadians(to.getLatitude());
        double dLat = lat2 - lat1;
        double dLng = Math.toRadians(to.getLongitude() - from.getLongitude());

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(a));
    }

    /* Scaled integer form of a coordinate component, used to build hash keys */
    public static long round(double value, int precision) {
        return Math.round(value * Math.pow(10, precision));
    }
}
