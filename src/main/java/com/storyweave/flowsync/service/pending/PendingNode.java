package com.storyweave.flowsync.service.pending;

import com.storyweave.flowsync.dto.graph.FlowNode;
import com.storyweave.flowsync.dto.graph.FlowNodeData;
import com.storyweave.flowsync.dto.graph.FlowNodeType;
import com.storyweave.flowsync.dto.graph.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A graph node staged in the pool until it is materialized in the script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingNode {

    private String id;
    private FlowNodeType type;
    private Position position;
    private FlowNodeData data;

    @Builder.Default
    private PendingNodeStatus status = PendingNodeStatus.CREATED;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    private ConnectionInfo connectedTo;

    // Set once synced
    private String astNodeId;
    private String labelName;

    public FlowNode toFlowNode() {
        return FlowNode.builder()
                .id(id)
                .type(type)
                .position(position)
                .data(data)
                .build();
    }
}
