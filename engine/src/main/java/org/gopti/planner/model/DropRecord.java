package org.gopti.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DropRecord {

    @JsonProperty("eventId")
    private String eventId;

    @JsonProperty("reason")
    private DropReason reason;
}
