package org.gopti.planner.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    private Solver solver = new Solver();
    private Fallback fallback = new Fallback();
    private Travel travel = new Travel();
    private Request request = new Request();
    private Response response = new Response();

    @Data
    public static class Solver {
        /* Wall-clock budget of the primary solver by surviving event count, ascending */
        private List<BudgetTier> budgetTiers = new ArrayList<>(List.of(
            new BudgetTier(5, Duration.ofMillis(150)),
            new BudgetTier(10, Duration.ofMillis(400)),
            new BudgetTier(15, Duration.ofMillis(1200))
        ));

        /* Skip penalty in objective seconds: max(floor, horizon * factor) */
        private long skipPenaltyFloor = 3000;
        private long skipPenaltyHorizonFactor = 4;

        /* Objective units are multiplied by this before going to the integer solver */
        private long costScale = 100;

        private String metaheuristic = "GREEDY_DESCENT";

        /* Arrival tolerated past a window end, priced by the late penalty; 0 keeps windows hard */
        private long lateToleranceSeconds = 0;

        /* Debug switch: go straight to the fallback heuristic */
        private boolean skipPrimary = false;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BudgetTier {
        private int maxEvents;
        private Duration budget;
    }

    @Data
    public static class Fallback {
        private int localSearchMaxIterations = 200;
    }

    @Data
    public static class Travel {
        /* estimate | osrm */
        private String provider = "estimate";
        private int maxConcurrentLookups = 8;
        private int legPrecision = 4;
        private int directionsPrecision = 5;
        private Duration timeBucket = Duration.ofMinutes(15);
        private Duration legTtl = Duration.ofHours(24);
        private Duration directionsTtl = Duration.ofDays(7);
        private Duration lastKnownTtl = Duration.ofDays(7);
    }

    @Data
    public static class Request {
        private int maxEvents = 24;
        private double defaultWalkingSpeed = 1.35;
        /* exclusive */
        private double minWalkingSpeed = 0.05;
        private double maxWalkingSpeed = 3.0;
    }

    @Data
    public static class Response {
        private boolean includePaths = false;
    }
}
