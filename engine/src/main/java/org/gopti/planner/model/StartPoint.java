package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartPoint {

    @NotNull
    @Valid
    @JsonProperty("location")
    private Coordinate location;

    @NotNull
    @JsonProperty("time")
    private Instant time;
}
