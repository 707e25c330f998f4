package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents a node in the flow graph.
 * A flow node may stand for zero, one or several script statements (see {@link FlowNodeData#getAstNodeIds()}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowNode {

    private String id;
    private FlowNodeType type;
    private Position position;
    private FlowNodeData data;

    @JsonIgnore
    public boolean isEntryPoint() {
        return type == FlowNodeType.SCENE;
    }
}
