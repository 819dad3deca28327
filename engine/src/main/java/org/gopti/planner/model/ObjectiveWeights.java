package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Objective coefficients. Any weight left null takes its default.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveWeights {
    public static final double DEFAULT_WALK = 1.0;
    public static final double DEFAULT_VISITED_BONUS = 0.4;
    public static final double DEFAULT_LATE_PENALTY = 2.0;
    public static final double DEFAULT_WAIT_PENALTY = 0.3;

    @PositiveOrZero
    @JsonProperty("walk")
    private Double walk;

    @PositiveOrZero
    @JsonProperty("visitedBonus")
    private Double visitedBonus;

    @PositiveOrZero
    @JsonProperty("latePenalty")
    private Double latePenalty;

    @PositiveOrZero
    @JsonProperty("waitPenalty")
    private Double waitPenalty;

    public static ObjectiveWeights defaults() {
        return new ObjectiveWeights(DEFAULT_WALK, DEFAULT_VISITED_BONUS, DEFAULT_LATE_PENALTY, DEFAULT_WAIT_PENALTY);
    }

    public ObjectiveWeights withDefaults() {
        return new ObjectiveWeights(
            walk != null ? walk : DEFAULT_WALK,
            visitedBonus != null ? visitedBonus : DEFAULT_VISITED_BONUS,
            latePenalty != null ? latePenalty : DEFAULT_LATE_PENALTY,
            waitPenalty != null ? waitPenalty : DEFAULT_WAIT_PENALTY
        );
    }
}
