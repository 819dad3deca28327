package org.gopti.planner.travel;

import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.model.Coordinate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TravelTimeCacheTest {

    private static final Coordinate FROM = new Coordinate(45.0, 7.0);
    private static final Coordinate TO = new Coordinate(45.001, 7.0);

    private MutableClock clock;
    private TravelTimeCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-06-01T10:00:00Z"));
        cache = new TravelTimeCache(new PlannerProperties(), clock);
    }

    @Test
    void departuresInDifferentBucketsDoNotPileUp() {
        var leg = new TravelLeg(80, 111.0, null);
        for (int i = 0; i < 500; i++) {
            cache.putLeg("osrm", FROM, TO, clock.instant(), leg);
            clock.advance(Duration.ofMinutes(15));
        }

        assertTrue(cache.legCount() <= 100, "legs " + cache.legCount());
        assertEquals(1, cache.lastKnownCount());
    }

    @Test
    void lastKnownOutlivesTheLegButNotForever() {
        cache.putLeg("osrm", FROM, TO, clock.instant(), new TravelLeg(80, 111.0, null));

        clock.advance(Duration.ofDays(2));
        assertTrue(cache.peekLeg("osrm", FROM, TO, clock.instant()).isEmpty());
        assertEquals(80, cache.lastKnown("osrm", FROM, TO).orElseThrow().getSeconds());

        clock.advance(Duration.ofDays(6));
        assertTrue(cache.lastKnown("osrm", FROM, TO).isEmpty());
    }
}
