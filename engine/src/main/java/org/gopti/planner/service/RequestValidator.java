package org.gopti.planner.service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.exception.InfeasibleInputException;
import org.gopti.planner.model.Event;
import org.gopti.planner.model.TripRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;

/**
 * Bean Validation on the request model plus the checks that span fields.
 */
@Component
public class RequestValidator {

    private final Validator validator;
    private final PlannerProperties.Request limits;

    @Autowired
    public RequestValidator(Validator validator, PlannerProperties properties) {
        this.validator = validator;
        this.limits = properties.getRequest();
    }

    public void validate(TripRequest request) {
        if (request == null) {
            throw new InfeasibleInputException(List.of("request must not be null"));
        }

        var violations = new ArrayList<String>();
        validator.validate(request).stream()
            .sorted(Comparator.comparing((ConstraintViolation<TripRequest> v) -> v.getPropertyPath().toString()))
            .forEach(v -> violations.add(v.getPropertyPath() + ": " + v.getMessage()));

        if (request.getStart() != null && request.getStart().getTime() != null && request.getEndTime() != null
            && !request.getEndTime().isAfter(request.getStart().getTime())) {
            violations.add("endTime: must be after the start time");
        }

        if (request.getWalkingSpeed() != null) {
            double speed = request.getWalkingSpeed();
            if (!(speed > limits.getMinWalkingSpeed() && speed <= limits.getMaxWalkingSpeed())) {
                violations.add(String.format("walkingSpeed: must be in (%s, %s]",
                    limits.getMinWalkingSpeed(), limits.getMaxWalkingSpeed()));
            }
        }

        if (request.getEvents() != null) {
            if (request.getEvents().size() > limits.getMaxEvents()) {
                violations.add(String.format("events: at most %d events are allowed", limits.getMaxEvents()));
            }

            var ids = new HashSet<String>();
            for (var event : request.getEvents()) {
                if (event == null) {
                    continue;
                }
                if (event.getId() != null && !ids.add(event.getId())) {
                    violations.add("events: duplicate id " + event.getId());
                }
                checkEvent(event, violations);
            }
        }

        if (!violations.isEmpty()) {
            throw new InfeasibleInputException(violations);
        }
    }

    private static void checkEvent(Event event, List<String> violations) {
        if (event.getDwellMin() > event.getDwellMax()) {
            violations.add(String.format("events[%s].dwellMin: must not exceed dwellMax", event.getId()));
        }
        var window = event.getWindow();
        if (window != null && window.getStart() != null && window.getEnd() != null
            && window.getStart().isAfter(window.getEnd())) {
            violations.add(String.format("events[%s].window: start must not be after end", event.getId()));
        }
    }
}
