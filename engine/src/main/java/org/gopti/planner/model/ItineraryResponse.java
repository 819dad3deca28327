package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItineraryResponse {

    @JsonProperty("route")
    private List<VisitRecord> route = new ArrayList<>();

    @JsonProperty("dropped")
    private List<DropRecord> dropped = new ArrayList<>();

    @JsonProperty("metrics")
    private SolveMetrics metrics;
}
