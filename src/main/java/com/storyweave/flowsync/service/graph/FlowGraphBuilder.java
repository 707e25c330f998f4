package com.storyweave.flowsync.service.graph;

import com.storyweave.flowsync.config.GraphBuilderSettings;
import com.storyweave.flowsync.dto.graph.*;
import com.storyweave.flowsync.model.script.*;
import com.storyweave.flowsync.service.sync.ScriptCloner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Builds the flow graph view of a script.
 *
 * Each entry point becomes a scene node. Its body is linearized into a chain: runs of dialogue and
 * visual statements merge into dialogue blocks, while menus, conditionals, jumps, calls and returns
 * get a node of their own. Menus and conditionals expose one port per choice or branch.
 * The input script is never modified, and port bodies in the graph are copies of the script's.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FlowGraphBuilder {

    private final GraphBuilderSettings settings;
    private final ScriptCloner cloner;

    public FlowGraph buildGraph(Script script) {
        BuildContext context = new BuildContext();

        // Pass 1: entry point names and their node ids, so forward jumps resolve
        for (LabelNode label : script.getLabels()) {
            context.labelNames.add(label.getName());
            context.labelNodeIds.putIfAbsent(label.getName(), context.nextId("scene"));
        }

        // Pass 2: nodes and edges
        Set<String> built = new HashSet<>();
        for (LabelNode label : script.getLabels()) {
            if (!built.add(label.getName())) {
                log.warn("Duplicate label {} skipped in graph", label.getName());
                continue;
            }
            FlowNode sceneNode = buildSceneNode(label, context);
            context.nodes.add(sceneNode);
            new BodyLinearizer(context, sceneNode.getId(), null).linearize(label.getBody());
        }

        markIncoming(context);
        log.debug("Built flow graph: {} nodes, {} edges", context.nodes.size(), context.edges.size());

        return FlowGraph.builder()
                .nodes(context.nodes)
                .edges(context.edges)
                .build();
    }

    // ========================= ENTRY POINTS =========================

    private FlowNode buildSceneNode(LabelNode label, BuildContext context) {
        return FlowNode.builder()
                .id(context.labelNodeIds.get(label.getName()))
                .type(FlowNodeType.SCENE)
                .position(Position.origin())
                .data(FlowNodeData.builder()
                        .label(label.getName())
                        .preview(generatePreview(label.getBody()))
                        .exitType(determineExitType(label.getBody()))
                        .hasIncoming(false)
                        .astNodeIds(new ArrayList<>(List.of(label.getId())))
                        .build())
                .build();
    }

    /**
     * Short text shown on a scene node: its first dialogue lines and scene/show statements.
     */
    public String generatePreview(List<ScriptNode> body) {
        List<String> lines = new ArrayList<>();
        for (ScriptNode statement : body) {
            if (lines.size() >= settings.getPreviewLines()) {
                break;
            }
            if (statement instanceof DialogueNode dialogue) {
                String speaker = dialogue.getSpeaker() != null ? dialogue.getSpeaker() : settings.getNarratorName();
                lines.add(speaker + ": \"" + truncate(dialogue.getText()) + "\"");
            } else if (statement instanceof SceneNode scene) {
                lines.add("scene " + scene.getImage());
            } else if (statement instanceof ShowNode show) {
                lines.add("show " + show.getImage());
            }
        }
        return String.join("\n", lines);
    }

    private String truncate(String text) {
        if (text == null) return "";
        int max = settings.getPreviewTextLength();
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }

    /**
     * How control leaves a body: by its last statement when that is a return, jump or menu,
     * otherwise by the first menu or jump anywhere in it, otherwise it falls through.
     */
    public ExitType determineExitType(List<ScriptNode> body) {
        if (body.isEmpty()) {
            return ExitType.FALL_THROUGH;
        }
        switch (body.get(body.size() - 1).getKind()) {
            case RETURN:
                return ExitType.RETURN;
            case JUMP:
                return ExitType.JUMP;
            case MENU:
                return ExitType.MENU;
            default:
                break;
        }
        for (ScriptNode statement : body) {
            if (statement.getKind() == StatementKind.MENU) return ExitType.MENU;
            if (statement.getKind() == StatementKind.JUMP) return ExitType.JUMP;
        }
        return ExitType.FALL_THROUGH;
    }

    // ========================= EDGES =========================

    private void addEdge(BuildContext context, String source, String target, String sourceHandle) {
        context.edges.add(FlowEdge.builder()
                .id("e-" + source + "-" + target + (sourceHandle != null ? "-" + sourceHandle : ""))
                .source(source)
                .target(target)
                .sourceHandle(sourceHandle)
                .type(FlowEdgeType.NORMAL)
                .targetState(EdgeTargetState.RESOLVED)
                .valid(true)
                .build());
    }

    /**
     * Jump or call edge to an entry point by name. Names that are not declared give an unresolved,
     * invalid edge that keeps the name.
     */
    private void addFlowEdge(BuildContext context, String source, String targetLabel,
                             FlowEdgeType type, String sourceHandle) {
        String suffix = sourceHandle != null ? "-" + sourceHandle : "";
        if (targetLabel == null || targetLabel.isBlank()) {
            context.edges.add(FlowEdge.builder()
                    .id("e-" + source + "-" + type.getValue() + suffix)
                    .source(source)
                    .sourceHandle(sourceHandle)
                    .type(type)
                    .targetState(EdgeTargetState.ABSENT)
                    .animated(type == FlowEdgeType.CALL)
                    .valid(false)
                    .build());
            return;
        }
        String targetNodeId = context.labelNodeIds.get(targetLabel);
        context.edges.add(FlowEdge.builder()
                .id("e-" + source + "-" + targetLabel + suffix)
                .source(source)
                .target(targetNodeId)
                .sourceHandle(sourceHandle)
                .type(type)
                .targetLabel(targetLabel)
                .targetState(targetNodeId != null ? EdgeTargetState.RESOLVED : EdgeTargetState.UNRESOLVED)
                .animated(type == FlowEdgeType.CALL)
                .valid(context.labelNames.contains(targetLabel))
                .build());
    }

    private void markIncoming(BuildContext context) {
        Set<String> targets = new HashSet<>();
        for (FlowEdge edge : context.edges) {
            if (edge.getType().isFlowTransfer() && edge.isResolved()) {
                targets.add(edge.getTarget());
            }
        }
        for (FlowNode node : context.nodes) {
            if (node.isEntryPoint()) {
                node.getData().setHasIncoming(targets.contains(node.getId()));
            }
        }
    }

    // ========================= BUILD STATE =========================

    private static final class BuildContext {
        private final Set<String> labelNames = new HashSet<>();
        private final Map<String, String> labelNodeIds = new HashMap<>();
        private final List<FlowNode> nodes = new ArrayList<>();
        private final List<FlowEdge> edges = new ArrayList<>();
        private int idCounter;

        private String nextId(String prefix) {
            return prefix + "-" + idCounter++;
        }
    }

    /**
     * Turns one body into a chain of flow nodes hanging off a previous node (and port, for choice and
     * branch bodies). Dialogue and visual statements accumulate into the open block; a scene statement
     * always opens a new one; every other flow statement closes the block and becomes its own node.
     * Statements with no graph form (set, python, pause, raw, nested labels) are skipped.
     */
    private final class BodyLinearizer implements ScriptNodeVisitor<Void> {

        private final BuildContext context;
        private String prevNodeId;
        private String prevHandle;

        private final List<DialogueItem> dialogues = new ArrayList<>();
        private final List<VisualCommand> visualCommands = new ArrayList<>();
        private final List<String> blockIds = new ArrayList<>();

        private BodyLinearizer(BuildContext context, String prevNodeId, String prevHandle) {
            this.context = context;
            this.prevNodeId = prevNodeId;
            this.prevHandle = prevHandle;
        }

        void linearize(List<ScriptNode> body) {
            for (ScriptNode statement : body) {
                statement.accept(this);
            }
            flushBlock();
        }

        private void flushBlock() {
            if (blockIds.isEmpty()) {
                return;
            }
            FlowNode block = FlowNode.builder()
                    .id(context.nextId("dialogue-block"))
                    .type(FlowNodeType.DIALOGUE_BLOCK)
                    .position(Position.origin())
                    .data(FlowNodeData.builder()
                            .dialogues(new ArrayList<>(dialogues))
                            .visualCommands(new ArrayList<>(visualCommands))
                            .expanded(false)
                            .astNodeIds(new ArrayList<>(blockIds))
                            .build())
                    .build();
            dialogues.clear();
            visualCommands.clear();
            blockIds.clear();
            chain(block);
        }

        private void chain(FlowNode node) {
            context.nodes.add(node);
            addEdge(context, prevNodeId, node.getId(), prevHandle);
            prevNodeId = node.getId();
            prevHandle = null;
        }

        private FlowNode standalone(String prefix, FlowNodeType type, FlowNodeData data) {
            flushBlock();
            FlowNode node = FlowNode.builder()
                    .id(context.nextId(prefix))
                    .type(type)
                    .position(Position.origin())
                    .data(data)
                    .build();
            chain(node);
            return node;
        }

        private void visual(ScriptNode statement, String target, List<String> attributes) {
            visualCommands.add(VisualCommand.builder()
                    .id(statement.getId())
                    .type(statement.getKind())
                    .target(target)
                    .attributes(attributes)
                    .build());
            blockIds.add(statement.getId());
        }

        /**
         * Wires one choice/branch body to its port: straight to the target when the body transfers
         * control, otherwise as a nested chain starting at the port.
         */
        private void linkPort(String ownerId, String portId, List<ScriptNode> body) {
            ScriptNode transfer = firstFlowTransfer(body);
            if (transfer instanceof JumpNode jump) {
                addFlowEdge(context, ownerId, jump.getTarget(), FlowEdgeType.JUMP, portId);
            } else if (transfer instanceof CallNode call) {
                addFlowEdge(context, ownerId, call.getTarget(), FlowEdgeType.CALL, portId);
            } else if (!body.isEmpty()) {
                new BodyLinearizer(context, ownerId, portId).linearize(body);
            }
        }

        @Override
        public Void visitDialogue(DialogueNode node) {
            dialogues.add(DialogueItem.builder()
                    .id(node.getId())
                    .speaker(node.getSpeaker())
                    .text(node.getText())
                    .attributes(node.getAttributes())
                    .build());
            blockIds.add(node.getId());
            return null;
        }

        @Override
        public Void visitScene(SceneNode node) {
            flushBlock();
            visual(node, node.getImage(), null);
            return null;
        }

        @Override
        public Void visitShow(ShowNode node) {
            visual(node, node.getImage(), node.getAttributes());
            return null;
        }

        @Override
        public Void visitHide(HideNode node) {
            visual(node, node.getImage(), null);
            return null;
        }

        @Override
        public Void visitWith(WithNode node) {
            visual(node, node.getTransition(), null);
            return null;
        }

        @Override
        public Void visitMenu(MenuNode node) {
            List<ChoicePort> choices = new ArrayList<>();
            for (int i = 0; i < node.getChoices().size(); i++) {
                MenuChoice choice = node.getChoices().get(i);
                choices.add(ChoicePort.builder()
                        .portId(PortIds.choice(i))
                        .text(choice.getText())
                        .condition(choice.getCondition())
                        .targetLabel(firstJumpTarget(choice.getBody()))
                        .body(cloner.cloneAll(choice.getBody()))
                        .build());
            }
            FlowNode menuNode = standalone("menu", FlowNodeType.MENU, FlowNodeData.builder()
                    .prompt(node.getPrompt())
                    .choices(choices)
                    .astNodeIds(new ArrayList<>(List.of(node.getId())))
                    .build());
            for (int i = 0; i < node.getChoices().size(); i++) {
                linkPort(menuNode.getId(), PortIds.choice(i), node.getChoices().get(i).getBody());
            }
            return null;
        }

        @Override
        public Void visitIf(IfNode node) {
            List<BranchPort> branches = new ArrayList<>();
            for (int i = 0; i < node.getBranches().size(); i++) {
                IfBranch branch = node.getBranches().get(i);
                branches.add(BranchPort.builder()
                        .portId(PortIds.branch(i))
                        .condition(branch.getCondition())
                        .targetLabel(firstJumpTarget(branch.getBody()))
                        .body(cloner.cloneAll(branch.getBody()))
                        .build());
            }
            String firstCondition = node.getBranches().isEmpty() ? null : node.getBranches().get(0).getCondition();
            FlowNode conditionNode = standalone("condition", FlowNodeType.CONDITION, FlowNodeData.builder()
                    .condition(firstCondition != null ? firstCondition : "")
                    .branches(branches)
                    .astNodeIds(new ArrayList<>(List.of(node.getId())))
                    .build());
            for (int i = 0; i < node.getBranches().size(); i++) {
                linkPort(conditionNode.getId(), PortIds.branch(i), node.getBranches().get(i).getBody());
            }
            return null;
        }

        @Override
        public Void visitJump(JumpNode node) {
            FlowNode jumpNode = standalone("jump", FlowNodeType.JUMP, FlowNodeData.builder()
                    .target(node.getTarget())
                    .call(false)
                    .astNodeIds(new ArrayList<>(List.of(node.getId())))
                    .build());
            addFlowEdge(context, jumpNode.getId(), node.getTarget(), FlowEdgeType.JUMP, null);
            return null;
        }

        @Override
        public Void visitCall(CallNode node) {
            FlowNode callNode = standalone("call", FlowNodeType.CALL, FlowNodeData.builder()
                    .target(node.getTarget())
                    .call(true)
                    .astNodeIds(new ArrayList<>(List.of(node.getId())))
                    .build());
            addFlowEdge(context, callNode.getId(), node.getTarget(), FlowEdgeType.CALL, null);
            return null;
        }

        @Override
        public Void visitReturn(ReturnNode node) {
            standalone("return", FlowNodeType.RETURN, FlowNodeData.builder()
                    .astNodeIds(new ArrayList<>(List.of(node.getId())))
                    .build());
            return null;
        }

        @Override
        public Void visitLabel(LabelNode node) {
            log.debug("Nested label {} has no graph form, skipped", node.getName());
            return null;
        }

        @Override
        public Void visitSet(SetNode node) {
            return null;
        }

        @Override
        public Void visitPython(PythonNode node) {
            return null;
        }

        @Override
        public Void visitPause(PauseNode node) {
            return null;
        }

        @Override
        public Void visitRaw(RawNode node) {
            return null;
        }
    }

    private static ScriptNode firstFlowTransfer(List<ScriptNode> body) {
        return body.stream()
                .filter(statement -> statement.getKind().isFlowTransfer())
                .findFirst()
                .orElse(null);
    }

    private static String firstJumpTarget(List<ScriptNode> body) {
        return body.stream()
                .filter(JumpNode.class::isInstance)
                .map(statement -> ((JumpNode) statement).getTarget())
                .findFirst()
                .orElse(null);
    }
}
