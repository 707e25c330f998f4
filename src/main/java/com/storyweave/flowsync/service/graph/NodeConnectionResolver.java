package com.storyweave.flowsync.service.graph;

import com.storyweave.flowsync.dto.graph.*;
import com.storyweave.flowsync.dto.sync.InsertPosition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Read-only queries over a flow graph: which entry point owns a node, neighbours, orphans,
 * reachability, and where a newly connected node belongs in the script.
 *
 * Ownership follows sequential-flow edges only; jump and call edges lead to other entry points
 * and never make a node part of them.
 */
@Service
@Slf4j
public class NodeConnectionResolver {

    // ========================= OWNERSHIP =========================

    /**
     * Name of the entry point a node belongs to, found by walking sequential-flow edges backwards.
     *
     * @return the label name, or null when no entry point reaches the node
     */
    public String resolveNodeLabel(String nodeId, FlowGraph graph) {
        FlowNode scene = getSceneNode(nodeId, graph);
        return scene != null && scene.getData() != null ? scene.getData().getLabel() : null;
    }

    /**
     * Entry point node owning the given node (the node itself for an entry point), or null.
     */
    public FlowNode getSceneNode(String nodeId, FlowGraph graph) {
        Map<String, FlowNode> nodes = indexNodes(graph);
        FlowNode start = nodes.get(nodeId);
        if (start != null && start.isEntryPoint()) {
            return start;
        }

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            String currentId = queue.poll();
            if (!visited.add(currentId)) {
                continue;
            }
            for (FlowEdge edge : graph.getEdges()) {
                if (!isSequential(edge) || !currentId.equals(edge.getTarget())) {
                    continue;
                }
                FlowNode source = nodes.get(edge.getSource());
                if (source == null) {
                    continue;
                }
                if (source.isEntryPoint()) {
                    return source;
                }
                if (!visited.contains(source.getId())) {
                    queue.add(source.getId());
                }
            }
        }
        return null;
    }

    public boolean isConnectedToScene(String nodeId, FlowGraph graph) {
        return resolveNodeLabel(nodeId, graph) != null;
    }

    /**
     * Non-entry nodes that no entry point reaches.
     */
    public List<FlowNode> getOrphanNodes(FlowGraph graph) {
        return graph.getNodes().stream()
                .filter(node -> !node.isEntryPoint())
                .filter(node -> !isConnectedToScene(node.getId(), graph))
                .toList();
    }

    // ========================= NEIGHBOURS =========================

    public String getPredecessor(String nodeId, FlowGraph graph) {
        return graph.getEdges().stream()
                .filter(edge -> isSequential(edge) && nodeId.equals(edge.getTarget()))
                .map(FlowEdge::getSource)
                .findFirst()
                .orElse(null);
    }

    public List<String> getAllPredecessors(String nodeId, FlowGraph graph) {
        return graph.getEdges().stream()
                .filter(edge -> nodeId.equals(edge.getTarget()))
                .map(FlowEdge::getSource)
                .toList();
    }

    /**
     * The node that follows in sequential flow, or null at the end of a chain.
     * Branching nodes have one successor per port; see {@link #getAllSuccessors}.
     */
    public String getSuccessor(String nodeId, FlowGraph graph) {
        return getSuccessor(nodeId, null, graph);
    }

    /**
     * Sequential successor leaving through the given port (null handle for the plain output).
     */
    public String getSuccessor(String nodeId, String sourceHandle, FlowGraph graph) {
        return graph.getEdges().stream()
                .filter(edge -> isSequential(edge) && nodeId.equals(edge.getSource()))
                .filter(edge -> Objects.equals(sourceHandle, edge.getSourceHandle()))
                .map(FlowEdge::getTarget)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    /**
     * Every node an outgoing edge leads to, across all ports and edge types. Unresolved targets are left out.
     */
    public List<String> getAllSuccessors(String nodeId, FlowGraph graph) {
        return graph.getEdges().stream()
                .filter(edge -> nodeId.equals(edge.getSource()) && edge.isResolved())
                .map(FlowEdge::getTarget)
                .toList();
    }

    public boolean isConnected(String nodeId, FlowGraph graph) {
        return graph.getEdges().stream().anyMatch(edge -> edge.touches(nodeId));
    }

    // ========================= PATHS =========================

    /**
     * Reachability over outgoing edges of any type. A node always reaches itself.
     */
    public boolean hasPath(String sourceId, String targetId, FlowGraph graph) {
        if (Objects.equals(sourceId, targetId)) {
            return true;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(sourceId);
        while (!queue.isEmpty()) {
            String currentId = queue.poll();
            if (!visited.add(currentId)) {
                continue;
            }
            for (FlowEdge edge : graph.getEdges()) {
                if (!currentId.equals(edge.getSource()) || !edge.isResolved()) {
                    continue;
                }
                if (edge.getTarget().equals(targetId)) {
                    return true;
                }
                if (!visited.contains(edge.getTarget())) {
                    queue.add(edge.getTarget());
                }
            }
        }
        return false;
    }

    /**
     * Node ids from the owning entry point down to the node, inclusive. Empty for orphans.
     */
    public List<String> getPathFromScene(String nodeId, FlowGraph graph) {
        FlowNode scene = getSceneNode(nodeId, graph);
        if (scene == null) {
            return List.of();
        }
        List<String> path = findPath(scene.getId(), nodeId, graph, new HashSet<>());
        return path != null ? path : List.of();
    }

    private List<String> findPath(String currentId, String targetId, FlowGraph graph, Set<String> visited) {
        if (currentId.equals(targetId)) {
            return new ArrayList<>(List.of(currentId));
        }
        if (!visited.add(currentId)) {
            return null;
        }
        for (FlowEdge edge : graph.getEdges()) {
            if (!isSequential(edge) || !currentId.equals(edge.getSource()) || edge.getTarget() == null) {
                continue;
            }
            List<String> rest = findPath(edge.getTarget(), targetId, graph, visited);
            if (rest != null) {
                rest.add(0, currentId);
                return rest;
            }
        }
        return null;
    }

    /**
     * Jump and call edges whose target entry point does not exist.
     */
    public List<FlowEdge> getInvalidEdges(FlowGraph graph) {
        return graph.getEdges().stream()
                .filter(edge -> edge.getType() != null && edge.getType().isFlowTransfer())
                .filter(edge -> !edge.isValid())
                .toList();
    }

    // ========================= INSERT POSITION =========================

    public InsertPosition determineInsertPosition(String sourceNodeId, String newNodeId, FlowGraph graph) {
        return determineInsertPosition(sourceNodeId, newNodeId, null, graph);
    }

    /**
     * Where a node connected after {@code sourceNodeId} goes in the script.
     *
     * From an entry point the node opens the label body. From a menu or conditional port it opens that
     * choice or branch body. From any other node it goes right after the last statement that node covers.
     * The existing successor of the source is reported as {@code beforeNodeId}.
     *
     * @return null when the source is not owned by an entry point, or has no statement to anchor on
     */
    public InsertPosition determineInsertPosition(String sourceNodeId, String newNodeId,
                                                  String sourceHandle, FlowGraph graph) {
        FlowNode source = graph.findNode(sourceNodeId).orElse(null);
        if (source == null) {
            log.debug("Insert source {} not found in graph", sourceNodeId);
            return null;
        }
        String labelName = resolveNodeLabel(sourceNodeId, graph);
        if (labelName == null) {
            log.debug("Insert source {} is not connected to any entry point", sourceNodeId);
            return null;
        }

        String before = successorExcluding(sourceNodeId, sourceHandle, newNodeId, graph);
        if (source.isEntryPoint()) {
            return InsertPosition.builder()
                    .labelName(labelName)
                    .beforeNodeId(before)
                    .build();
        }

        String anchor = source.getData() != null ? source.getData().lastConstituentId() : null;
        if (anchor == null) {
            log.debug("Insert source {} has no statement to anchor on", sourceNodeId);
            return null;
        }

        Integer portIndex = source.getType().isBranching() ? PortIds.parsePortIndex(sourceHandle) : null;
        if (portIndex != null) {
            return InsertPosition.builder()
                    .labelName(labelName)
                    .parentNodeId(anchor)
                    .portIndex(portIndex)
                    .beforeNodeId(before)
                    .build();
        }

        return InsertPosition.builder()
                .labelName(labelName)
                .afterNodeId(anchor)
                .beforeNodeId(before)
                .build();
    }

    private String successorExcluding(String sourceNodeId, String sourceHandle, String excludedId, FlowGraph graph) {
        return graph.getEdges().stream()
                .filter(edge -> isSequential(edge) && sourceNodeId.equals(edge.getSource()))
                .filter(edge -> Objects.equals(sourceHandle, edge.getSourceHandle()))
                .map(FlowEdge::getTarget)
                .filter(target -> target != null && !target.equals(excludedId))
                .findFirst()
                .orElse(null);
    }

    private static boolean isSequential(FlowEdge edge) {
        return edge.getType() == null || edge.getType() == FlowEdgeType.NORMAL;
    }

    private static Map<String, FlowNode> indexNodes(FlowGraph graph) {
        Map<String, FlowNode> nodes = new HashMap<>();
        graph.getNodes().forEach(node -> nodes.putIfAbsent(node.getId(), node));
        return nodes;
    }
}
