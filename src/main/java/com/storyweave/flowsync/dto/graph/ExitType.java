package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How control leaves an entry point's body.
 */
public enum ExitType {
    RETURN("return"),
    JUMP("jump"),
    MENU("menu"),
    FALL_THROUGH("fall-through");

    private final String value;

    ExitType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
