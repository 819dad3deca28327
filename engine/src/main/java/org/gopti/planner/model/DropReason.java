package org.gopti.planner.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.gopti.planner.converter.Coded;
import org.gopti.planner.converter.CodedSerializer;

@JsonSerialize(using = CodedSerializer.class)
public enum DropReason implements Coded {
    WINDOW_CONFLICT("window_conflict"),
    TIME_BUDGET_EXCEEDED("time_budget_exceeded"),
    BOOKING_CONFLICT("booking_conflict"),
    LOW_PRIORITY("low_priority");

    private final String code;

    DropReason(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
