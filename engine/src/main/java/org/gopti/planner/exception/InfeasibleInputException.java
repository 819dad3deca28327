package org.gopti.planner.exception;

import lombok.Getter;

import java.util.List;

/**
 * Malformed trip request that no amount of dropping can repair.
 */
@Getter
public class InfeasibleInputException extends RuntimeException {
    private final List<String> violations;

    public InfeasibleInputException(List<String> violations) {
        super("Infeasible input: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
