package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enum representing the different types of nodes in the flow graph.
 */
public enum FlowNodeType {
    SCENE("scene"),
    DIALOGUE_BLOCK("dialogue-block"),
    MENU("menu"),
    CONDITION("condition"),
    JUMP("jump"),
    CALL("call"),
    RETURN("return");

    private final String value;

    FlowNodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Menus and conditions expose one output port per choice or branch.
     */
    public boolean isBranching() {
        return this == MENU || this == CONDITION;
    }

    /**
     * Get the enum value from its wire value or constant name, case-insensitive.
     */
    public static FlowNodeType fromString(String value) {
        if (value == null) return null;
        for (FlowNodeType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        try {
            return valueOf(value.toUpperCase().replace("-", "_").replace(" ", "_"));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
