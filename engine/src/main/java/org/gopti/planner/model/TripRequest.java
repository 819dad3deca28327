package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class TripRequest {

    @NotNull
    @Valid
    @JsonProperty("start")
    private StartPoint start;

    /* Absent means open-ended: the last visited venue is the end. */
    @Valid
    @JsonProperty("end")
    private Coordinate end;

    @NotNull
    @JsonProperty("endTime")
    private Instant endTime;

    /* Meters per second, only read by the estimate provider */
    @JsonProperty("walkingSpeed")
    private Double walkingSpeed;

    @Valid
    @JsonProperty("weights")
    private ObjectiveWeights weights;

    @NotNull
    @JsonProperty("events")
    private List<@Valid @NotNull Event> events = new ArrayList<>();

    public boolean hasFixedEnd() {
        return end != null;
    }
}
