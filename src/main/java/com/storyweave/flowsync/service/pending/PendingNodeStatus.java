package com.storyweave.flowsync.service.pending;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a node created in the graph before it exists in the script.
 */
public enum PendingNodeStatus {
    CREATED("created"),
    CONNECTED("connected"),
    SYNCED("synced"),
    ORPHAN("orphan");

    private final String value;

    PendingNodeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * created → connected | orphan, connected → synced | orphan, orphan → connected.
     * Synced is final. Staying in the same status is allowed.
     */
    public boolean canTransitionTo(PendingNodeStatus next) {
        if (next == null) return false;
        if (next == this) return true;
        return switch (this) {
            case CREATED -> next == CONNECTED || next == ORPHAN;
            case CONNECTED -> next == SYNCED || next == ORPHAN;
            case ORPHAN -> next == CONNECTED;
            case SYNCED -> false;
        };
    }
}
