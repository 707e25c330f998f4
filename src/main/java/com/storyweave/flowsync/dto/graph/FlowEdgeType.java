package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowEdgeType {
    NORMAL("normal"),   // sequential flow in body order
    JUMP("jump"),
    CALL("call"),
    RETURN("return");

    private final String value;

    FlowEdgeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isFlowTransfer() {
        return this == JUMP || this == CALL;
    }
}
