package org.gopti.planner.util;

import org.gopti.planner.model.Coordinate;

import java.util.List;

/**
 * Encoded polyline algorithm format, the one OSRM returns with {@code geometries=polyline}.
 */
public class PolylineEncoder {
    public static final int DEFAULT_PRECISION = 5;

    public static String encode(List<Coordinate> points) {
        return encode(points, DEFAULT_PRECISION);
    }

    public static String encode(List<Coordinate> points, int precision) {
        var result = new StringBuilder();
        long previousLat = 0;
        long previousLng = 0;

        for (var point : points) {
            long lat = GeoUtils.round(point.getLatitude(), precision);
            long lng = GeoUtils.round(point.getLongitude(), precision);
            encodeValue(lat - previousLat, result);
            encodeValue(lng - previousLng, result);
            previousLat = lat;
            previousLng = lng;
        }
        return result.toString();
    }

    private static void encodeValue(long value, StringBuilder out) {
        long shifted = value < 0 ? ~(value << 1) : value << 1;
        while (shifted >= 0x20) {
            out.append((char) ((0x20 | (shifted & 0x1f)) + 63));
            shifted >>= 5;
        }
        out.append((char) (shifted + 63));
    }
}
