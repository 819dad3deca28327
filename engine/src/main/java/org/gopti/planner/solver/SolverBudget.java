package org.gopti.planner.solver;

import org.gopti.planner.config.PlannerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;

/**
 * Primary-solver wall-clock budget by problem size.
 */
@Component
public class SolverBudget {
    private static final Duration DEFAULT_BUDGET = Duration.ofMillis(1200);

    private final PlannerProperties properties;

    @Autowired
    public SolverBudget(PlannerProperties properties) {
        this.properties = properties;
    }

    public Duration budgetFor(int eventCount) {
        var tiers = properties.getSolver().getBudgetTiers().stream()
            .sorted(Comparator.comparingInt(PlannerProperties.BudgetTier::getMaxEvents))
            .toList();

        if (tiers.isEmpty()) {
            return DEFAULT_BUDGET;
        }
        for (var tier : tiers) {
            if (eventCount <= tier.getMaxEvents()) {
                return tier.getBudget();
            }
        }
        return tiers.get(tiers.size() - 1).getBudget();
    }
}
