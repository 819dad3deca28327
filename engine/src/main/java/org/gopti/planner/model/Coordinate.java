package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Coordinate {

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    @JsonProperty("lat")
    private Double latitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    @JsonProperty("lng")
    private Double longitude;

    /* OSRM expects "lon,lat" pairs */
    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.6f,%.6f", longitude, latitude);
    }
}
