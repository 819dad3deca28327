package org.gopti.planner.model.osrm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

/**
 * Envelope shared by the OSRM table and route services.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OSRMResponse {
    public static final String CODE_OK = "Ok";

    private String code;
    private String message;

    /* table service */
    private List<List<Double>> durations;
    private List<List<Double>> distances;

    /* route service */
    private List<OSRMRoute> routes;

    public boolean isOk() {
        return CODE_OK.equals(code);
    }
}
