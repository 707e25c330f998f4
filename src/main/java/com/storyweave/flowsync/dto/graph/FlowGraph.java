package com.storyweave.flowsync.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Complete flow graph: the derived, editable view of a script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowGraph {

    @Builder.Default
    private List<FlowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<FlowEdge> edges = new ArrayList<>();

    public Optional<FlowNode> findNode(String nodeId) {
        if (nodeId == null) return Optional.empty();
        return nodes.stream().filter(n -> nodeId.equals(n.getId())).findFirst();
    }

    public Optional<FlowNode> findEntryPoint(String labelName) {
        if (labelName == null) return Optional.empty();
        return nodes.stream()
                .filter(FlowNode::isEntryPoint)
                .filter(n -> n.getData() != null && labelName.equals(n.getData().getLabel()))
                .findFirst();
    }
}
