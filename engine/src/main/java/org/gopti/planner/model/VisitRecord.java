package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitRecord {

    @JsonProperty("eventId")
    private String eventId;

    /* Moment the event is entered, after any wait for the window to open */
    @JsonProperty("arrive")
    private Instant arrive;

    @JsonProperty("depart")
    private Instant depart;

    @JsonProperty("dwellSec")
    private long dwellSec;

    @JsonProperty("travelSecFromPrev")
    private long travelSecFromPrev;

    @JsonProperty("waitSec")
    private long waitSec;

    @JsonProperty("path")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String path;
}
