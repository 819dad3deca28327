package org.gopti.planner.model.osrm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OSRMRoute {
    private Double distance;
    private Double duration;
    /* polyline5-encoded */
    private String geometry;
}
