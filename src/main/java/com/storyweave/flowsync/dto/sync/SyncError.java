package com.storyweave.flowsync.dto.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncError {

    private SyncErrorType type;
    private String message;
    private String nodeId;          // offending graph or script node, when known
    private String existingNodeId;  // for duplicate_label: the entry point already holding the name

    public static SyncError of(SyncErrorType type, String message) {
        return SyncError.builder().type(type).message(message).build();
    }

    public static SyncError of(SyncErrorType type, String message, String nodeId) {
        return SyncError.builder().type(type).message(message).nodeId(nodeId).build();
    }
}
