package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Interval during which an event can be entered, both ends inclusive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeWindow {

    @NotNull
    @JsonProperty("start")
    private Instant start;

    @NotNull
    @JsonProperty("end")
    private Instant end;

    public long startSecondsFrom(Instant origin) {
        return Duration.between(origin, start).getSeconds();
    }

    public long endSecondsFrom(Instant origin) {
        return Duration.between(origin, end).getSeconds();
    }
}
