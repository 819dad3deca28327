package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolveMetrics {

    @JsonProperty("totalWalkSec")
    private long totalWalkSec;

    @JsonProperty("totalWaitSec")
    private long totalWaitSec;

    @JsonProperty("visited")
    private int visited;

    @JsonProperty("dropped")
    private int dropped;

    @JsonProperty("solveMs")
    private long solveMs;

    @JsonProperty("stage")
    private SolveStage stage;

    /* Set when routed travel times were replaced by straight-line estimates */
    @JsonProperty("degraded")
    private boolean degraded;

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("objective")
    private double objective;
}
