package com.storyweave.flowsync.dto.sync;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure taxonomy reported to callers instead of exceptions.
 */
public enum SyncErrorType {
    INVALID_TARGET("invalid_target"),       // jump/call names a missing entry point; reported only
    MISSING_LABEL("missing_label"),         // insert target entry point does not exist; aborted
    DUPLICATE_LABEL("duplicate_label"),
    INVALID_NAME("invalid_name"),
    INVALID_INDEX("invalid_index"),         // choice/branch index out of range
    INVALID_POSITION("invalid_position"),   // no insert position could be resolved
    UNSUPPORTED_NODE("unsupported_node"),
    SYNC_FAILED("sync_failed");

    private final String code;

    SyncErrorType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
