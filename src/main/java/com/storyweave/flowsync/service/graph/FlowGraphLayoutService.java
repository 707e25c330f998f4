package com.storyweave.flowsync.service.graph;

import com.storyweave.flowsync.config.LayoutSettings;
import com.storyweave.flowsync.dto.graph.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Top-to-bottom layered layout.
 *
 * Entry points sit on rank 0; every other node sits one rank below the deepest node that flows into it.
 * Nodes of one rank are laid out left to right in graph order. Nodes nothing reaches stay on rank 0.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FlowGraphLayoutService {

    private final LayoutSettings settings;

    /**
     * Copy of the graph with positions assigned. Positions are top-left corners.
     */
    public FlowGraph autoLayout(FlowGraph graph) {
        Map<String, Integer> ranks = computeRanks(graph);

        Map<Integer, List<FlowNode>> byRank = new TreeMap<>();
        for (FlowNode node : graph.getNodes()) {
            byRank.computeIfAbsent(ranks.getOrDefault(node.getId(), 0), r -> new ArrayList<>()).add(node);
        }

        Map<String, Position> positions = new HashMap<>();
        double y = settings.getMargin();
        for (List<FlowNode> row : byRank.values()) {
            double x = settings.getMargin();
            double rowHeight = 0;
            for (FlowNode node : row) {
                positions.put(node.getId(), new Position(x, y));
                x += settings.getNodeWidth() + settings.getHorizontalSpacing();
                rowHeight = Math.max(rowHeight, nodeHeight(node));
            }
            y += rowHeight + settings.getVerticalSpacing();
        }

        List<FlowNode> nodes = graph.getNodes().stream()
                .map(node -> FlowNode.builder()
                        .id(node.getId())
                        .type(node.getType())
                        .position(positions.getOrDefault(node.getId(), node.getPosition()))
                        .data(node.getData())
                        .build())
                .toList();

        log.debug("Laid out {} nodes on {} ranks", nodes.size(), byRank.size());
        return FlowGraph.builder()
                .nodes(new ArrayList<>(nodes))
                .edges(new ArrayList<>(graph.getEdges()))
                .build();
    }

    /**
     * Height of a node's box, grown by its dialogue, choice or branch count.
     */
    public double nodeHeight(FlowNode node) {
        double base = settings.getNodeHeight();
        FlowNodeData data = node.getData();
        if (data == null || node.getType() == null) {
            return base;
        }
        return switch (node.getType()) {
            case DIALOGUE_BLOCK -> Math.max(base, 80 + size(data.getDialogues()) * 20);
            case MENU -> Math.max(base, 80 + size(data.getChoices()) * 30);
            case CONDITION -> Math.max(base, 80 + size(data.getBranches()) * 30);
            default -> base;
        };
    }

    private Map<String, Integer> computeRanks(FlowGraph graph) {
        Map<String, Integer> ranks = new HashMap<>();
        Set<String> known = new HashSet<>();
        for (FlowNode node : graph.getNodes()) {
            known.add(node.getId());
            if (node.isEntryPoint()) {
                ranks.put(node.getId(), 0);
            }
        }

        // Longest-path relaxation, bounded by the node count so cycles cannot loop forever
        int limit = graph.getNodes().size();
        boolean changed = true;
        for (int round = 0; changed && round < limit; round++) {
            changed = false;
            for (FlowEdge edge : graph.getEdges()) {
                if (edge.getType() != FlowEdgeType.NORMAL || !known.contains(edge.getTarget())) {
                    continue;
                }
                Integer sourceRank = ranks.get(edge.getSource());
                if (sourceRank == null) {
                    continue;
                }
                int candidate = Math.min(sourceRank + 1, limit);
                if (candidate > ranks.getOrDefault(edge.getTarget(), -1)) {
                    ranks.put(edge.getTarget(), candidate);
                    changed = true;
                }
            }
        }
        return ranks;
    }

    private static int size(List<?> items) {
        return items == null ? 0 : items.size();
    }
}
