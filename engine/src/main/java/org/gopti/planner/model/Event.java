package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    @NotBlank
    @JsonProperty("id")
    private String id;

    @NotNull
    @Valid
    @JsonProperty("location")
    private Coordinate location;

    @NotNull
    @Valid
    @JsonProperty("window")
    private TimeWindow window;

    /* Minutes */
    @Min(1)
    @JsonProperty("dwellMin")
    private int dwellMin;

    @Min(1)
    @JsonProperty("dwellMax")
    private int dwellMax;

    @PositiveOrZero
    @JsonProperty("popularity")
    private double popularity;

    @JsonProperty("bookingRequired")
    private boolean bookingRequired;

    @Override
    public String toString() {
        return id;
    }
}
