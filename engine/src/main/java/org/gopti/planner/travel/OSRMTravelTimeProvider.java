package org.gopti.planner.travel;

import org.gopti.planner.config.OSRMConfiguration;
import org.gopti.planner.exception.provider.ProviderRateLimitedException;
import org.gopti.planner.exception.provider.ProviderUnavailableException;
import org.gopti.planner.model.Coordinate;
import org.gopti.planner.model.osrm.OSRMResponse;
import org.gopti.planner.util.ArrayUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Walking legs from an OSRM instance running the foot profile. OSRM ignores
 * the departure time.
 */
@Service
public class OSRMTravelTimeProvider implements ITravelTimeProvider {
    public static final String MODE = "osrm";

    private final RestClient restClient;
    private final OSRMConfiguration osrmConfig;

    @Autowired
    public OSRMTravelTimeProvider(RestClient restClient, OSRMConfiguration osrmConfig) {
        this.restClient = restClient;
        this.osrmConfig = osrmConfig;
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public TravelLeg duration(Coordinate from, Coordinate to, Instant departAt) {
        var uri = String.format("%s/%s/%s?%s",
            osrmConfig.getBaseUrl(),
            osrmConfig.getRouteEndpoint(),
            parseCoordinates(List.of(from, to)),
            osrmConfig.getRouteParams());

        var result = query(uri, "route");
        if (result.getRoutes() == null || result.getRoutes().isEmpty()) {
            throw new ProviderUnavailableException(MODE, "OSRM route returned no routes");
        }

        var route = result.getRoutes().get(0);
        if (route.getDuration() == null || route.getDistance() == null) {
            throw new ProviderUnavailableException(MODE, "OSRM route returned an incomplete route");
        }
        return new TravelLeg(route.getDuration().longValue(), route.getDistance(), route.getGeometry());
    }

    @Override
    public TravelLeg[][] matrix(List<Coordinate> points, Instant departAt) {
        int size = points.size();
        var legs = new TravelLeg[size][size];
        int batchSize = Math.max(1, osrmConfig.getBatchSize());

        /* Each block sends its sources and destinations as one coordinate list */
        for (int sourceStart = 0; sourceStart < size; sourceStart += batchSize) {
            int sourceEnd = Math.min(sourceStart + batchSize, size);
            for (int destStart = 0; destStart < size; destStart += batchSize) {
                int destEnd = Math.min(destStart + batchSize, size);
                fillBlock(points, legs, sourceStart, sourceEnd, destStart, destEnd);
            }
        }
        return legs;
    }

    private void fillBlock(
        List<Coordinate> points,
        TravelLeg[][] legs,
        int sourceStart,
        int sourceEnd,
        int destStart,
        int destEnd
    ) {
        var coordinates = new ArrayList<Coordinate>(points.subList(sourceStart, sourceEnd));
        coordinates.addAll(points.subList(destStart, destEnd));
        int sourceCount = sourceEnd - sourceStart;
        int destCount = destEnd - destStart;

        var uri = String.format("%s/%s/%s?%s&sources=%s&destinations=%s",
            osrmConfig.getBaseUrl(),
            osrmConfig.getTableEndpoint(),
            parseCoordinates(coordinates),
            osrmConfig.getTableParams(),
            joinRange(0, sourceCount),
            joinRange(sourceCount, sourceCount + destCount));

        var result = query(uri, "table");
        if (result.getDurations() == null || result.getDistances() == null) {
            throw new ProviderUnavailableException(MODE, "OSRM table returned no annotations");
        }

        long[][] durations;
        double[][] distances;
        try {
            durations = ArrayUtils.convertTo2DLongArray(result.getDurations());
            distances = ArrayUtils.convertTo2DDoubleArray(result.getDistances());
        } catch (IllegalArgumentException ex) {
            throw new ProviderUnavailableException(MODE, "OSRM table is incomplete: " + ex.getMessage(), ex);
        }
        if (durations.length != sourceCount || durations[0].length != destCount) {
            throw new ProviderUnavailableException(MODE, "OSRM table has unexpected dimensions");
        }

        for (int i = 0; i < sourceCount; i++) {
            for (int j = 0; j < destCount; j++) {
                int from = sourceStart + i;
                int to = destStart + j;
                legs[from][to] = from == to ? TravelLeg.ZERO : new TravelLeg(durations[i][j], distances[i][j], null);
            }
        }
    }

    private OSRMResponse query(String uri, String service) {
        OSRMResponse result;
        try {
            result = restClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(OSRMResponse.class);
        } catch (HttpClientErrorException ex) {
            if (ex.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)) {
                throw new ProviderRateLimitedException(MODE, "OSRM " + service + " rate limited", ex);
            }
            throw new ProviderUnavailableException(MODE, "OSRM " + service + " failed: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw new ProviderUnavailableException(MODE, "OSRM " + service + " failed: " + ex.getMessage(), ex);
        }

        if (result == null) {
            throw new ProviderUnavailableException(MODE, "OSRM " + service + " returned null");
        }
        if (!result.isOk()) {
            throw new ProviderUnavailableException(MODE,
                String.format("OSRM %s returned %s: %s", service, result.getCode(), result.getMessage()));
        }
        return result;
    }

    private static String parseCoordinates(List<Coordinate> coordinates) {
        return coordinates
            .stream()
            .map(Coordinate::toString)
            .collect(Collectors.joining(";"));
    }

    private static String joinRange(int fromInclusive, int toExclusive) {
        return IntStream.range(fromInclusive, toExclusive)
            .mapToObj(String::valueOf)
            .collect(Collectors.joining(";"));
    }
}
