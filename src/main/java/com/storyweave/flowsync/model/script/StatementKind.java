package com.storyweave.flowsync.model.script;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminant of every statement kind in a script tree.
 */
public enum StatementKind {
    LABEL("label"),
    DIALOGUE("dialogue"),
    MENU("menu"),
    IF("if"),
    JUMP("jump"),
    CALL("call"),
    RETURN("return"),
    SCENE("scene"),
    SHOW("show"),
    HIDE("hide"),
    WITH("with"),
    SET("set"),
    PYTHON("python"),
    PAUSE("pause"),
    RAW("raw");

    private final String code;

    StatementKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Jump and call statements reference an entry point by name.
     */
    public boolean isFlowTransfer() {
        return this == JUMP || this == CALL;
    }

    /**
     * Scene, show, hide and with are visual statements that merge into content blocks.
     */
    public boolean isVisual() {
        return this == SCENE || this == SHOW || this == HIDE || this == WITH;
    }
}
