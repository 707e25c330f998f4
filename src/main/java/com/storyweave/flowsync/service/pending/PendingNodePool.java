package com.storyweave.flowsync.service.pending;

import com.storyweave.flowsync.dto.graph.FlowNodeData;
import com.storyweave.flowsync.dto.graph.Position;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Staging store for nodes created in the graph that have no script statements yet.
 * A node id absent from the pool is backed by the script alone.
 *
 * Not thread-safe: one editor session owns one pool.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PendingNodePool {

    private final Clock clock;
    private final Map<String, PendingNode> nodes = new LinkedHashMap<>();

    public void add(PendingNode node) {
        LocalDateTime now = now();
        if (node.getCreatedAt() == null) {
            node.setCreatedAt(now);
        }
        if (node.getStatus() == null) {
            node.setStatus(PendingNodeStatus.CREATED);
        }
        node.setUpdatedAt(now);
        nodes.put(node.getId(), node);
        log.debug("Pending node added: {} ({})", node.getId(), node.getType());
    }

    public boolean remove(String nodeId) {
        return nodes.remove(nodeId) != null;
    }

    public Optional<PendingNode> get(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<PendingNode> getAll() {
        return new ArrayList<>(nodes.values());
    }

    public boolean isPending(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    public void clear() {
        nodes.clear();
    }

    // ========================= STATUS =========================

    /**
     * Moves a node to a new status if the lifecycle allows it.
     *
     * @return false when the node is unknown or the transition is not allowed
     */
    public boolean updateStatus(String nodeId, PendingNodeStatus status) {
        PendingNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        if (!node.getStatus().canTransitionTo(status)) {
            log.warn("Rejected pending node transition {} -> {} for {}", node.getStatus(), status, nodeId);
            return false;
        }
        node.setStatus(status);
        node.setUpdatedAt(now());
        return true;
    }

    /**
     * Records where the node was connected from and moves it to connected.
     */
    public boolean updateConnection(String nodeId, ConnectionInfo connection) {
        PendingNode node = nodes.get(nodeId);
        if (node == null || !node.getStatus().canTransitionTo(PendingNodeStatus.CONNECTED)) {
            return false;
        }
        node.setConnectedTo(connection);
        node.setStatus(PendingNodeStatus.CONNECTED);
        node.setUpdatedAt(now());
        return true;
    }

    public boolean markSynced(String nodeId, String astNodeId, String labelName) {
        PendingNode node = nodes.get(nodeId);
        if (node == null || !node.getStatus().canTransitionTo(PendingNodeStatus.SYNCED)) {
            return false;
        }
        node.setStatus(PendingNodeStatus.SYNCED);
        node.setAstNodeId(astNodeId);
        node.setLabelName(labelName);
        node.setUpdatedAt(now());
        return true;
    }

    public List<PendingNode> getByStatus(PendingNodeStatus status) {
        return nodes.values().stream()
                .filter(node -> node.getStatus() == status)
                .toList();
    }

    public List<PendingNode> getOrphanNodes() {
        return getByStatus(PendingNodeStatus.ORPHAN);
    }

    public List<PendingNode> getConnectedNodes() {
        return getByStatus(PendingNodeStatus.CONNECTED);
    }

    // ========================= PARTIAL UPDATES =========================

    /**
     * Applies the non-null fields of {@code patch} to the node's data. Status is unchanged.
     */
    public boolean updateData(String nodeId, FlowNodeData patch) {
        PendingNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        node.setData(node.getData() != null ? node.getData().merge(patch) : patch);
        node.setUpdatedAt(now());
        return true;
    }

    public boolean updatePosition(String nodeId, Position position) {
        PendingNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        node.setPosition(position);
        node.setUpdatedAt(now());
        return true;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
