package org.gopti.planner.service;

import jakarta.validation.Validation;
import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.exception.InfeasibleInputException;
import org.gopti.planner.model.Coordinate;
import org.gopti.planner.model.TripRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;

import static org.gopti.planner.service.TripRequests.event;
import static org.gopti.planner.service.TripRequests.request;
import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {

    private RequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RequestValidator(Validation.buildDefaultValidatorFactory().getValidator(), new PlannerProperties());
    }

    private InfeasibleInputException rejected(TripRequest request) {
        return assertThrows(InfeasibleInputException.class, () -> validator.validate(request));
    }

    @Test
    void acceptsWellFormedRequest() {
        assertDoesNotThrow(() -> validator.validate(request(Duration.ofHours(3),
            event("a", 0.001, 0.0, 10, 30, 1.0),
            event("b", 0.002, 0.0, 10, 30, 2.0))));
    }

    @Test
    void acceptsEmptyEventList() {
        assertDoesNotThrow(() -> validator.validate(request(Duration.ofHours(1))));
    }

    @Test
    void endTimeMustFollowStart() {
        var ex = rejected(request(Duration.ZERO));
        assertTrue(ex.getViolations().stream().anyMatch(v -> v.startsWith("endTime")));

        rejected(request(Duration.ofMinutes(-5)));
    }

    @Test
    void dwellRangeMustBeOrderedAndPositive() {
        rejected(request(Duration.ofHours(3), event("a", 0.001, 0.0, 30, 10, 1.0)));
        rejected(request(Duration.ofHours(3), event("a", 0.001, 0.0, 0, 10, 1.0)));
    }

    @Test
    void windowMustBeOrdered() {
        rejected(request(Duration.ofHours(3),
            event("a", 0.001, 0.0, Duration.ofHours(2), Duration.ofHours(1), 10, 10, 1.0)));
    }

    @Test
    void idsMustBeUnique() {
        var ex = rejected(request(Duration.ofHours(3),
            event("a", 0.001, 0.0, 10, 10, 1.0),
            event("a", 0.002, 0.0, 10, 10, 1.0)));
        assertTrue(ex.getViolations().contains("events: duplicate id a"));
    }

    @Test
    void atMostTwentyFourEvents() {
        var request = request(Duration.ofHours(3));
        var events = new ArrayList<>(request.getEvents());
        for (int i = 0; i < 25; i++) {
            events.add(event("e" + i, 0.0001 * i, 0.0, 10, 10, 1.0));
        }
        request.setEvents(events);

        rejected(request);
    }

    @Test
    void walkingSpeedRangeIsOpenBelowClosedAbove() {
        var request = request(Duration.ofHours(1));

        request.setWalkingSpeed(0.05);
        rejected(request);

        request.setWalkingSpeed(3.0);
        assertDoesNotThrow(() -> validator.validate(request));

        request.setWalkingSpeed(3.01);
        rejected(request);
    }

    @Test
    void coordinatesMustBeOnTheGlobe() {
        var request = request(Duration.ofHours(1), event("a", 0.0, 0.0, 10, 10, 1.0));
        request.getEvents().get(0).setLocation(new Coordinate(91.0, 7.0));

        rejected(request);
    }

    @Test
    void popularityMustNotBeNegative() {
        rejected(request(Duration.ofHours(1), event("a", 0.001, 0.0, 10, 10, -1.0)));
    }

    @Test
    void missingStartIsRejected() {
        var request = request(Duration.ofHours(1));
        request.setStart(null);

        rejected(request);
        rejected(null);
    }
}
