package org.gopti.planner.travel;

import lombok.Value;
import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.model.Coordinate;
import org.gopti.planner.util.GeoUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Process-wide travel-time memory shared by all solves.
 * <p>
 * Legs are keyed by provider mode, rounded endpoints and a departure time
 * bucket. Directions (encoded paths) are keyed by finer rounded endpoints and
 * live longer. The last value seen for each rounded pair is kept regardless of
 * departure time, for as long as directions are, so a failing provider can be
 * bridged with stale data.
 */
@Component
public class TravelTimeCache {

    private final PlannerProperties.Travel config;
    private final SingleFlightCache<LegKey, TravelLeg> legs;
    private final SingleFlightCache<PairKey, String> directions;
    private final SingleFlightCache<PairKey, TravelLeg> lastKnown;

    @Autowired
    public TravelTimeCache(PlannerProperties properties, Clock clock) {
        this.config = properties.getTravel();
        this.legs = new SingleFlightCache<>(config.getLegTtl(), clock);
        this.directions = new SingleFlightCache<>(config.getDirectionsTtl(), clock);
        this.lastKnown = new SingleFlightCache<>(config.getLastKnownTtl(), clock);
    }

    public TravelLeg leg(String mode, Coordinate from, Coordinate to, Instant departAt, Supplier<TravelLeg> loader) {
        var leg = legs.get(legKey(mode, from, to, departAt), loader);
        lastKnown.put(pairKey(mode, from, to, config.getLegPrecision()), leg);
        return leg;
    }

    public Optional<TravelLeg> peekLeg(String mode, Coordinate from, Coordinate to, Instant departAt) {
        return legs.getIfPresent(legKey(mode, from, to, departAt));
    }

    public void putLeg(String mode, Coordinate from, Coordinate to, Instant departAt, TravelLeg leg) {
        legs.put(legKey(mode, from, to, departAt), leg);
        lastKnown.put(pairKey(mode, from, to, config.getLegPrecision()), leg);
    }

    public Optional<TravelLeg> lastKnown(String mode, Coordinate from, Coordinate to) {
        return lastKnown.getIfPresent(pairKey(mode, from, to, config.getLegPrecision()));
    }

    public String path(String mode, Coordinate from, Coordinate to, Supplier<String> loader) {
        return directions.get(pairKey(mode, from, to, config.getDirectionsPrecision()), loader);
    }

    public int legCount() {
        return legs.size();
    }

    public int lastKnownCount() {
        return lastKnown.size();
    }

    public void clear() {
        legs.invalidateAll();
        directions.invalidateAll();
        lastKnown.invalidateAll();
    }

    private LegKey legKey(String mode, Coordinate from, Coordinate to, Instant departAt) {
        int precision = config.getLegPrecision();
        long bucket = Math.floorDiv(departAt.getEpochSecond(), Math.max(1, config.getTimeBucket().getSeconds()));
        return new LegKey(
            mode,
            GeoUtils.round(from.getLatitude(), precision),
            GeoUtils.round(from.getLongitude(), precision),
            GeoUtils.round(to.getLatitude(), precision),
            GeoUtils.round(to.getLongitude(), precision),
            bucket
        );
    }

    private static PairKey pairKey(String mode, Coordinate from, Coordinate to, int precision) {
        return new PairKey(
            mode,
            GeoUtils.round(from.getLatitude(), precision),
            GeoUtils.round(from.getLongitude(), precision),
            GeoUtils.round(to.getLatitude(), precision),
            GeoUtils.round(to.getLongitude(), precision)
        );
    }

    @Value
    private static class LegKey {
        String mode;
        long fromLat;
        long fromLng;
        long toLat;
        long toLng;
        long bucket;
    }

    @Value
    private static class PairKey {
        String mode;
        long fromLat;
        long fromLng;
        long toLat;
        long toLng;
    }
}
