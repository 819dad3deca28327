package org.gopti.planner.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.gopti.planner.converter.Coded;
import org.gopti.planner.converter.CodedSerializer;

/**
 * Which part of the engine produced the returned itinerary.
 */
@JsonSerialize(using = CodedSerializer.class)
public enum SolveStage implements Coded {
    PRIMARY("primary"),
    FALLBACK_GREEDY("fallback-greedy"),
    FALLBACK_LOCAL_SEARCH("fallback-local-search"),
    FALLBACK_COMPRESSED("fallback-compressed"),
    FALLBACK_DROPPED("fallback-dropped");

    private final String code;

    SolveStage(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
