package com.storyweave.flowsync.service.pending;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The node (and port) a pending node was connected from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionInfo {
    private String sourceNodeId;
    private String sourceHandle;
}
