package org.gopti.planner.travel;

import org.gopti.planner.model.Coordinate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EstimateTravelTimeProviderTest {

    private static final Instant START = Instant.parse("2026-06-01T10:00:00Z");

    @Test
    void walksGreatCircleDistanceAtGivenSpeed() {
        var provider = new EstimateTravelTimeProvider(1.35);

        var leg = provider.duration(new Coordinate(0.0, 0.0), new Coordinate(0.01, 0.0), START);

        /* 0.01 degrees of latitude, about 1112 m */
        assertEquals(1111.95, leg.getMeters(), 0.01);
        assertEquals(823, leg.getSeconds());
        assertNotNull(leg.getPath());
    }

    @Test
    void modeIncludesSpeed() {
        assertEquals("estimate@1.350", new EstimateTravelTimeProvider(1.35).mode());
        assertNotEquals(new EstimateTravelTimeProvider(1.0).mode(), new EstimateTravelTimeProvider(1.35).mode());
    }

    @Test
    void matrixIsSymmetricWithZeroDiagonal() {
        var provider = new EstimateTravelTimeProvider(1.0);
        var points = List.of(new Coordinate(45.0, 7.0), new Coordinate(45.001, 7.001), new Coordinate(45.003, 7.0));

        var legs = provider.matrix(points, START);

        for (int i = 0; i < 3; i++) {
            assertEquals(0, legs[i][i].getSeconds());
            for (int j = 0; j < 3; j++) {
                assertEquals(legs[i][j].getSeconds(), legs[j][i].getSeconds());
            }
        }
        assertTrue(legs[0][2].getSeconds() > legs[0][1].getSeconds());
    }

    @Test
    void rejectsNonPositiveSpeed() {
        assertThrows(IllegalArgumentException.class, () -> new EstimateTravelTimeProvider(0.0));
    }
}
