package com.storyweave.flowsync.service.operation;

import com.storyweave.flowsync.dto.graph.*;
import com.storyweave.flowsync.dto.sync.*;
import com.storyweave.flowsync.model.script.*;
import com.storyweave.flowsync.service.graph.NodeConnectionResolver;
import com.storyweave.flowsync.service.pending.ConnectionInfo;
import com.storyweave.flowsync.service.pending.PendingNode;
import com.storyweave.flowsync.service.pending.PendingNodePool;
import com.storyweave.flowsync.service.pending.PendingNodeStatus;
import com.storyweave.flowsync.service.sync.AstSynchronizer;
import com.storyweave.flowsync.service.sync.ScriptCloner;
import com.storyweave.flowsync.service.sync.ScriptNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * User-level graph operations: create, connect, delete, disconnect and commit.
 *
 * Nodes created in the graph stay in the {@link PendingNodePool} until a connection gives them a place
 * in the script. Every operation leaves the input script untouched and returns the script to use next.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NodeOperationHandler {

    private final PendingNodePool pendingNodePool;
    private final NodeConnectionResolver connectionResolver;
    private final AstSynchronizer astSynchronizer;
    private final ScriptNodeFactory nodeFactory;
    private final ScriptCloner cloner;

    // ========================= CREATE =========================

    /**
     * Stages a new node with default data for its type, overridden by any non-null field of {@code data}.
     *
     * @return id of the pending node
     */
    public String createNode(FlowNodeType type, Position position, FlowNodeData data) {
        String nodeId = nodeFactory.newId(type.getValue());
        PendingNode node = PendingNode.builder()
                .id(nodeId)
                .type(type)
                .position(position != null ? position : Position.origin())
                .data(defaultDataFor(type).merge(data))
                .status(PendingNodeStatus.CREATED)
                .build();
        pendingNodePool.add(node);
        log.info("Created pending {} node {}", type.getValue(), nodeId);
        return nodeId;
    }

    public String createNode(FlowNodeType type, Position position) {
        return createNode(type, position, null);
    }

    FlowNodeData defaultDataFor(FlowNodeType type) {
        return switch (type) {
            case DIALOGUE_BLOCK -> FlowNodeData.builder()
                    .dialogues(new ArrayList<>(List.of(DialogueItem.builder()
                            .id(nodeFactory.newId("dialogue"))
                            .text("New dialogue")
                            .build())))
                    .visualCommands(new ArrayList<>())
                    .expanded(true)
                    .build();
            case MENU -> FlowNodeData.builder()
                    .choices(new ArrayList<>(List.of(
                            ChoicePort.builder().portId(PortIds.choice(0)).text("Choice 1").build(),
                            ChoicePort.builder().portId(PortIds.choice(1)).text("Choice 2").build())))
                    .build();
            case SCENE -> FlowNodeData.builder()
                    .label("new_label")
                    .preview("")
                    .exitType(ExitType.FALL_THROUGH)
                    .build();
            case JUMP -> FlowNodeData.builder().target("").call(false).build();
            case CALL -> FlowNodeData.builder().target("").call(true).build();
            case CONDITION -> FlowNodeData.builder()
                    .condition("True")
                    .branches(new ArrayList<>(List.of(
                            BranchPort.builder().portId(PortIds.branch(0)).condition("True").build(),
                            BranchPort.builder().portId(PortIds.branch(1)).build())))
                    .build();
            case RETURN -> FlowNodeData.builder().build();
        };
    }

    // ========================= CONNECT =========================

    /**
     * Connects two nodes. A pending target is written into the script at the position the source
     * determines, then leaves the pool together with any pending nodes chained after it. Between two
     * nodes already in the script, only connections with a script form (choice/branch jumps, jump and
     * call targets) change the script.
     */
    public ConnectResult connectNodes(String sourceId, String targetId, String sourceHandle,
                                      FlowGraph graph, Script script) {
        Optional<PendingNode> pending = pendingNodePool.get(targetId);
        if (pending.isPresent()) {
            if (pendingNodePool.isPending(sourceId)) {
                // Both ends are new; the target is written right after its source reaches the script
                pendingNodePool.updateConnection(targetId, ConnectionInfo.builder()
                        .sourceNodeId(sourceId)
                        .sourceHandle(sourceHandle)
                        .build());
                log.debug("Pending node {} connected to pending source {}", targetId, sourceId);
                return visualOnly(script);
            }
            ConnectResult result = syncPendingNode(pending.get(), sourceId, sourceHandle, graph, script, Map.of());
            if (result.isSuccess()) {
                result.setScript(syncDependents(pending.get(), graph, result.getScript()));
            }
            return result;
        }
        return connectExistingNodes(sourceId, targetId, sourceHandle, graph, script);
    }

    /**
     * Writes the pending nodes recorded as connected to {@code synced}, each anchored on the statements
     * just written for its source, then their own dependents. A dependent that cannot be written has
     * lost its source and becomes an orphan.
     */
    private Script syncDependents(PendingNode synced, FlowGraph graph, Script script) {
        Script current = script;
        for (PendingNode dependent : dependentsOf(synced.getId())) {
            if (!pendingNodePool.isPending(dependent.getId())) {
                continue;
            }
            ConnectResult result = syncPendingNode(dependent, synced.getId(), dependent.getConnectedTo().getSourceHandle(),
                    graph, current, Map.of(synced.getId(), synced));
            if (result.isSuccess()) {
                current = syncDependents(dependent, graph, result.getScript());
            } else {
                log.warn("Chained pending node {} could not follow {}: {}", dependent.getId(), synced.getId(),
                        result.getError().getMessage());
                pendingNodePool.updateStatus(dependent.getId(), PendingNodeStatus.ORPHAN);
            }
        }
        return current;
    }

    private List<PendingNode> dependentsOf(String sourceId) {
        return pendingNodePool.getAll().stream()
                .filter(node -> node.getConnectedTo() != null
                        && sourceId.equals(node.getConnectedTo().getSourceNodeId()))
                .toList();
    }

    private ConnectResult connectExistingNodes(String sourceId, String targetId, String sourceHandle,
                                               FlowGraph graph, Script script) {
        FlowNode source = graph.findNode(sourceId).orElse(null);
        FlowNode target = graph.findNode(targetId).orElse(null);
        if (source == null || target == null) {
            return connectFailed(script, SyncError.of(SyncErrorType.INVALID_POSITION,
                    "Source or target node not found", source == null ? sourceId : targetId));
        }

        if (!target.isEntryPoint()) {
            String sourceLabel = connectionResolver.resolveNodeLabel(sourceId, graph);
            String targetLabel = connectionResolver.resolveNodeLabel(targetId, graph);
            if (sourceLabel != null && targetLabel != null && !sourceLabel.equals(targetLabel)
                    && !connectionResolver.hasPath(sourceId, targetId, graph)) {
                log.warn("Rejected connection {} -> {}: target already belongs to label {}",
                        sourceId, targetId, targetLabel);
                return connectFailed(script, SyncError.of(SyncErrorType.INVALID_POSITION,
                        "Target node already belongs to label " + targetLabel, targetId));
            }
            return visualOnly(script);
        }

        String labelName = target.getData() != null ? target.getData().getLabel() : null;
        String statementId = source.getData() != null ? source.getData().lastConstituentId() : null;
        if (labelName == null || statementId == null) {
            return visualOnly(script);
        }

        Script working = astSynchronizer.cloneAst(script);
        boolean applied;
        switch (source.getType()) {
            case MENU -> {
                Integer choiceIndex = PortIds.parseChoiceIndex(sourceHandle);
                if (choiceIndex == null) {
                    return visualOnly(script);
                }
                applied = astSynchronizer.insertJumpIntoChoice(statementId, choiceIndex, labelName, working);
            }
            case CONDITION -> {
                Integer branchIndex = PortIds.parseBranchIndex(sourceHandle);
                if (branchIndex == null) {
                    return visualOnly(script);
                }
                applied = astSynchronizer.insertJumpIntoConditionBranch(statementId, branchIndex, labelName, working);
            }
            case JUMP, CALL -> applied = astSynchronizer.updateFlowTarget(statementId, labelName, working);
            default -> {
                return visualOnly(script);
            }
        }

        if (!applied) {
            return connectFailed(script, SyncError.of(SyncErrorType.INVALID_INDEX,
                    "No choice or branch at " + sourceHandle, sourceId));
        }
        log.info("Connected {} -> label {}", sourceId, labelName);
        return ConnectResult.builder()
                .success(true)
                .script(working)
                .astNodeId(statementId)
                .build();
    }

    /**
     * Writes a pending node into a clone of the script. {@code syncedSources} maps pending nodes synced
     * earlier in the same commit to themselves, so a chain of new nodes can anchor on each other.
     */
    private ConnectResult syncPendingNode(PendingNode pending, String sourceId, String sourceHandle,
                                          FlowGraph graph, Script script, Map<String, PendingNode> syncedSources) {
        pendingNodePool.updateConnection(pending.getId(), ConnectionInfo.builder()
                .sourceNodeId(sourceId)
                .sourceHandle(sourceHandle)
                .build());

        Script working = astSynchronizer.cloneAst(script);
        if (pending.getType() == FlowNodeType.SCENE) {
            return materializeLabel(pending, sourceId, sourceHandle, graph, script, working, syncedSources);
        }

        InsertPosition position = resolvePosition(sourceId, pending.getId(), sourceHandle, graph, syncedSources);
        if (position == null) {
            log.warn("No insert position for pending node {} from {}", pending.getId(), sourceId);
            return connectFailed(script, SyncError.of(SyncErrorType.INVALID_POSITION,
                    "Could not determine insert position", pending.getId()));
        }

        List<ScriptNode> statements;
        try {
            statements = buildStatements(pending);
        } catch (IllegalArgumentException e) {
            return connectFailed(script, SyncError.of(SyncErrorType.UNSUPPORTED_NODE, e.getMessage(), pending.getId()));
        }
        if (statements.isEmpty()) {
            return connectFailed(script, SyncError.of(SyncErrorType.SYNC_FAILED,
                    "Node has nothing to write", pending.getId()));
        }

        String firstId = astSynchronizer.insertStatement(position, statements.get(0), working);
        if (firstId == null) {
            return connectFailed(script, SyncError.of(SyncErrorType.MISSING_LABEL,
                    "Could not insert into label " + position.getLabelName(), pending.getId()));
        }
        String previousId = firstId;
        for (ScriptNode statement : statements.subList(1, statements.size())) {
            previousId = astSynchronizer.insertStatement(InsertPosition.builder()
                    .labelName(position.getLabelName())
                    .afterNodeId(previousId)
                    .build(), statement, working);
        }

        completeSync(pending, previousId, position.getLabelName());
        return ConnectResult.builder()
                .success(true)
                .script(working)
                .astNodeId(firstId)
                .build();
    }

    private ConnectResult materializeLabel(PendingNode pending, String sourceId, String sourceHandle,
                                           FlowGraph graph, Script script, Script working,
                                           Map<String, PendingNode> syncedSources) {
        String labelName = pending.getData() != null ? pending.getData().getLabel() : null;
        AddLabelResult added = astSynchronizer.addLabel(labelName, working);
        if (!added.isSuccess()) {
            SyncError error = added.getError();
            error.setNodeId(pending.getId());
            return connectFailed(script, error);
        }

        // The source now points at the new label where the script can express it
        PendingNode syncedSource = syncedSources.get(sourceId);
        FlowNode source = syncedSource == null ? graph.findNode(sourceId).orElse(null) : null;
        FlowNodeType sourceType = syncedSource != null ? syncedSource.getType()
                : source != null ? source.getType() : null;
        String statementId = syncedSource != null ? syncedSource.getAstNodeId()
                : source != null && source.getData() != null ? source.getData().lastConstituentId() : null;
        if (sourceType != null && statementId != null) {
            switch (sourceType) {
                case MENU -> Optional.ofNullable(PortIds.parseChoiceIndex(sourceHandle))
                        .ifPresent(index -> astSynchronizer.insertJumpIntoChoice(statementId, index, labelName, working));
                case CONDITION -> Optional.ofNullable(PortIds.parseBranchIndex(sourceHandle))
                        .ifPresent(index -> astSynchronizer.insertJumpIntoConditionBranch(statementId, index, labelName, working));
                case JUMP, CALL -> astSynchronizer.updateFlowTarget(statementId, labelName, working);
                default -> log.debug("Source {} has no script link to label {}", sourceId, labelName);
            }
        }

        completeSync(pending, added.getLabelId(), labelName);
        return ConnectResult.builder()
                .success(true)
                .script(working)
                .astNodeId(added.getLabelId())
                .build();
    }

    private InsertPosition resolvePosition(String sourceId, String pendingId, String sourceHandle,
                                           FlowGraph graph, Map<String, PendingNode> syncedSources) {
        PendingNode syncedSource = syncedSources.get(sourceId);
        if (syncedSource != null) {
            if (syncedSource.getType() == FlowNodeType.SCENE) {
                return InsertPosition.builder().labelName(syncedSource.getLabelName()).build();
            }
            Integer portIndex = syncedSource.getType().isBranching() ? PortIds.parsePortIndex(sourceHandle) : null;
            if (portIndex != null) {
                return InsertPosition.builder()
                        .labelName(syncedSource.getLabelName())
                        .parentNodeId(syncedSource.getAstNodeId())
                        .portIndex(portIndex)
                        .build();
            }
            return InsertPosition.builder()
                    .labelName(syncedSource.getLabelName())
                    .afterNodeId(syncedSource.getAstNodeId())
                    .build();
        }
        if (pendingNodePool.isPending(sourceId)) {
            return null;
        }
        return connectionResolver.determineInsertPosition(sourceId, pendingId, sourceHandle, graph);
    }

    private List<ScriptNode> buildStatements(PendingNode pending) {
        FlowNodeData data = pending.getData() != null ? pending.getData() : new FlowNodeData();
        return switch (pending.getType()) {
            case DIALOGUE_BLOCK -> data.getDialogues() == null ? List.of() : data.getDialogues().stream()
                    .map(item -> (ScriptNode) nodeFactory.createDialogue(DialogueData.builder()
                            .speaker(item.getSpeaker())
                            .text(item.getText())
                            .attributes(item.getAttributes() != null ? item.getAttributes() : new ArrayList<>())
                            .build()))
                    .toList();
            case MENU -> data.getChoices() == null || data.getChoices().isEmpty() ? List.of()
                    : List.of(nodeFactory.createMenu(MenuData.builder()
                    .prompt(data.getPrompt())
                    .choices(data.getChoices().stream()
                            .map(choice -> MenuChoice.builder()
                                    .text(choice.getText())
                                    .condition(choice.getCondition())
                                    .body(cloner.cloneAll(choice.getBody()))
                                    .build())
                            .toList())
                    .build()));
            case CONDITION -> data.getBranches() == null || data.getBranches().isEmpty() ? List.of()
                    : List.of(nodeFactory.createCondition(data.getBranches().stream()
                    .map(branch -> IfBranch.builder()
                            .condition(branch.getCondition())
                            .body(cloner.cloneAll(branch.getBody()))
                            .build())
                    .toList()));
            case JUMP -> hasTarget(data) ? List.of(nodeFactory.createJump(data.getTarget())) : List.of();
            case CALL -> hasTarget(data) ? List.of(nodeFactory.createCall(data.getTarget(), null)) : List.of();
            case RETURN -> List.of(nodeFactory.createReturn(null));
            case SCENE -> throw new IllegalArgumentException("Entry points are added as labels, not statements");
        };
    }

    private static boolean hasTarget(FlowNodeData data) {
        return data.getTarget() != null && !data.getTarget().isBlank();
    }

    private void completeSync(PendingNode pending, String astNodeId, String labelName) {
        pendingNodePool.markSynced(pending.getId(), astNodeId, labelName);
        pending.setAstNodeId(astNodeId);
        pending.setLabelName(labelName);
        pendingNodePool.remove(pending.getId());
        log.info("Synced pending node {} into label {} as {}", pending.getId(), labelName, astNodeId);
    }

    private static ConnectResult visualOnly(Script script) {
        return ConnectResult.builder().success(true).script(script).build();
    }

    private static ConnectResult connectFailed(Script script, SyncError error) {
        return ConnectResult.builder().success(false).script(script).error(error).build();
    }

    // ========================= DELETE / DISCONNECT =========================

    /**
     * Deletes a node. A pending node only leaves the pool; any other node is removed from the script.
     */
    public DeleteResult deleteNode(String nodeId, FlowGraph graph, Script script) {
        if (pendingNodePool.remove(nodeId)) {
            log.info("Discarded pending node {}", nodeId);
            return DeleteResult.builder().script(script).build();
        }
        return astSynchronizer.deleteNode(nodeId, graph, script);
    }

    /**
     * Removes the script form of an edge: the jump or call behind a jump/call edge, or the jump in a
     * choice or branch body. Edges with no script form succeed without changes.
     */
    public OperationResult removeConnection(FlowEdge edge, FlowGraph graph, Script script) {
        FlowNode source = graph.findNode(edge.getSource()).orElse(null);
        if (source == null || source.getData() == null) {
            return OperationResult.ok(script);
        }
        String targetLabel = edge.getTargetLabel() != null ? edge.getTargetLabel()
                : graph.findNode(edge.getTarget())
                .filter(node -> node.isEntryPoint() && node.getData() != null)
                .map(node -> node.getData().getLabel())
                .orElse(null);
        if (targetLabel == null) {
            return OperationResult.ok(script);
        }

        String statementId = source.getData().lastConstituentId();
        Script working = astSynchronizer.cloneAst(script);
        boolean removed = switch (source.getType()) {
            case JUMP, CALL -> {
                if (statementId != null) {
                    yield astSynchronizer.removeStatement(statementId, working);
                }
                StatementKind kind = source.getType() == FlowNodeType.JUMP ? StatementKind.JUMP : StatementKind.CALL;
                String owner = connectionResolver.resolveNodeLabel(source.getId(), graph);
                yield owner != null && astSynchronizer.removeFlowStatement(owner, targetLabel, working, kind);
            }
            case MENU -> {
                Integer index = PortIds.parseChoiceIndex(edge.getSourceHandle());
                yield index != null && astSynchronizer.removeJumpFromChoice(statementId, index, targetLabel, working);
            }
            case CONDITION -> {
                Integer index = PortIds.parseBranchIndex(edge.getSourceHandle());
                yield index != null && astSynchronizer.removeJumpFromConditionBranch(statementId, index, targetLabel, working);
            }
            default -> false;
        };

        if (!removed) {
            return OperationResult.ok(script);
        }
        log.info("Removed connection {} from script", edge.getId());
        return OperationResult.ok(working);
    }

    // ========================= COMMIT =========================

    public CommitResult commitPendingNodes(FlowGraph graph, Script script) {
        return commitPendingNodes(graph, script, false);
    }

    /**
     * Writes every connected pending node into the script, sources before the nodes chained after them.
     * Orphans, and nodes whose pending source was not written, are reported and, unless
     * {@code includeOrphans} is set, never reach the script.
     */
    public CommitResult commitPendingNodes(FlowGraph graph, Script script, boolean includeOrphans) {
        Script current = script;
        List<String> syncedNodeIds = new ArrayList<>();
        List<String> orphanNodeIds = new ArrayList<>();
        List<SyncError> errors = new ArrayList<>();
        Map<String, PendingNode> syncedThisCommit = new HashMap<>();

        for (PendingNode pending : inDependencyOrder(pendingNodePool.getAll())) {
            PendingNodeStatus status = pending.getStatus();
            if (status == PendingNodeStatus.SYNCED) {
                syncedNodeIds.add(pending.getId());
                pendingNodePool.remove(pending.getId());
                continue;
            }
            ConnectionInfo connection = pending.getConnectedTo();
            // Synced sources have left the pool, so a source still here was not written
            boolean sourceStaged = connection != null && pendingNodePool.isPending(connection.getSourceNodeId());
            if (status == PendingNodeStatus.CREATED || status == PendingNodeStatus.ORPHAN || sourceStaged) {
                orphanNodeIds.add(pending.getId());
                if (!includeOrphans || connection == null || sourceStaged) {
                    continue;
                }
            }

            ConnectResult result = syncPendingNode(pending, connection.getSourceNodeId(),
                    connection.getSourceHandle(), graph, current, syncedThisCommit);
            if (result.isSuccess()) {
                current = result.getScript();
                syncedNodeIds.add(pending.getId());
                syncedThisCommit.put(pending.getId(), pending);
            } else {
                errors.add(result.getError());
            }
        }

        log.info("Committed pending nodes: {} synced, {} orphans, {} errors",
                syncedNodeIds.size(), orphanNodeIds.size(), errors.size());
        return CommitResult.builder()
                .success(errors.isEmpty())
                .script(current)
                .syncedNodeIds(syncedNodeIds)
                .orphanNodeIds(orphanNodeIds)
                .errors(errors)
                .build();
    }

    /**
     * Pending nodes ordered so that every node comes after the pending node it is connected from.
     * Pool order is kept otherwise; a cycle is broken where it is first entered.
     */
    private List<PendingNode> inDependencyOrder(List<PendingNode> nodes) {
        Map<String, PendingNode> byId = new LinkedHashMap<>();
        nodes.forEach(node -> byId.put(node.getId(), node));
        List<PendingNode> ordered = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        nodes.forEach(node -> addAfterSource(node, byId, visited, ordered));
        return ordered;
    }

    private void addAfterSource(PendingNode node, Map<String, PendingNode> byId, Set<String> visited,
                                List<PendingNode> ordered) {
        if (!visited.add(node.getId())) {
            return;
        }
        ConnectionInfo connection = node.getConnectedTo();
        PendingNode source = connection != null ? byId.get(connection.getSourceNodeId()) : null;
        if (source != null) {
            addAfterSource(source, byId, visited, ordered);
        }
        ordered.add(node);
    }

    // ========================= ORPHANS =========================

    /**
     * Re-evaluates pending nodes against the graph topology: attached nodes return from orphan to
     * connected, detached created or connected nodes become orphans. A pending node is attached when
     * the graph connects it to an entry point, or its recorded source is attached.
     */
    public void refreshOrphans(FlowGraph graph) {
        Map<String, Boolean> attached = new HashMap<>();
        for (PendingNode pending : pendingNodePool.getAll()) {
            boolean isAttached = isAttached(pending.getId(), graph, attached, new HashSet<>());
            PendingNodeStatus status = pending.getStatus();
            if (isAttached && status == PendingNodeStatus.ORPHAN && pending.getConnectedTo() != null) {
                pendingNodePool.updateStatus(pending.getId(), PendingNodeStatus.CONNECTED);
            } else if (!isAttached && (status == PendingNodeStatus.CREATED || status == PendingNodeStatus.CONNECTED)) {
                pendingNodePool.updateStatus(pending.getId(), PendingNodeStatus.ORPHAN);
            }
        }
    }

    private boolean isAttached(String nodeId, FlowGraph graph, Map<String, Boolean> memo, Set<String> visiting) {
        if (memo.containsKey(nodeId)) {
            return memo.get(nodeId);
        }
        PendingNode pending = pendingNodePool.get(nodeId).orElse(null);
        if (pending == null) {
            return connectionResolver.isConnectedToScene(nodeId, graph);
        }
        if (!visiting.add(nodeId)) {
            return false;
        }
        boolean result = connectionResolver.isConnectedToScene(nodeId, graph)
                || (pending.getConnectedTo() != null
                && isAttached(pending.getConnectedTo().getSourceNodeId(), graph, memo, visiting));
        memo.put(nodeId, result);
        return result;
    }

    /**
     * Graph nodes no entry point reaches, plus pending nodes that are not connected.
     */
    public List<FlowNode> getOrphanNodes(FlowGraph graph) {
        refreshOrphans(graph);
        List<FlowNode> orphans = new ArrayList<>();
        connectionResolver.getOrphanNodes(graph).stream()
                .filter(node -> !pendingNodePool.isPending(node.getId()))
                .forEach(orphans::add);
        pendingNodePool.getAll().stream()
                .filter(node -> node.getStatus() == PendingNodeStatus.ORPHAN)
                .map(PendingNode::toFlowNode)
                .forEach(orphans::add);
        return orphans;
    }

    // ========================= PENDING ACCESSORS =========================

    public boolean isPendingNode(String nodeId) {
        return pendingNodePool.isPending(nodeId);
    }

    public Optional<PendingNode> getPendingNode(String nodeId) {
        return pendingNodePool.get(nodeId);
    }

    public List<PendingNode> getAllPendingNodes() {
        return pendingNodePool.getAll();
    }

    public boolean updatePendingNodeData(String nodeId, FlowNodeData patch) {
        return pendingNodePool.updateData(nodeId, patch);
    }

    public boolean updatePendingNodePosition(String nodeId, Position position) {
        return pendingNodePool.updatePosition(nodeId, position);
    }

    public void clearPendingNodes() {
        pendingNodePool.clear();
    }
}
