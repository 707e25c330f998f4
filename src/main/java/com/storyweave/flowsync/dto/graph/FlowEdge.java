package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents an edge in the flow graph.
 *
 * Jump and call edges whose target entry point does not exist yet have no target node:
 * {@code targetState} is UNRESOLVED, {@code target} is null and {@code targetLabel} names the missing entry point.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowEdge {

    private String id;
    private String source;          // Source node ID
    private String target;          // Target node ID, null unless RESOLVED
    private String sourceHandle;    // Port on a menu/condition source (choice-N, branch-N)
    private String targetHandle;
    private FlowEdgeType type;
    private String targetLabel;     // Entry point name for jump/call edges
    private EdgeTargetState targetState;
    private boolean animated;
    private boolean valid;          // Target entry point currently exists

    @JsonIgnore
    public boolean isResolved() {
        return targetState == null ? target != null : targetState == EdgeTargetState.RESOLVED;
    }

    public boolean touches(String nodeId) {
        return nodeId != null && (nodeId.equals(source) || nodeId.equals(target));
    }
}
