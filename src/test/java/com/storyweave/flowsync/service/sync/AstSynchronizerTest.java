package com.storyweave.flowsync.service.sync;

import com.storyweave.flowsync.config.GraphBuilderSettings;
import com.storyweave.flowsync.dto.graph.*;
import com.storyweave.flowsync.dto.sync.*;
import com.storyweave.flowsync.model.script.*;
import com.storyweave.flowsync.service.graph.FlowGraphBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.storyweave.flowsync.ScriptFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class AstSynchronizerTest {

    private final ScriptTreeWalker walker = new ScriptTreeWalker();
    private AstSynchronizer synchronizer;
    private FlowGraphBuilder graphBuilder;

    @BeforeEach
    void setUp() {
        synchronizer = new AstSynchronizer(walker, new ScriptCloner(), new ScriptNodeFactory());
        graphBuilder = new FlowGraphBuilder(GraphBuilderSettings.defaults(), new ScriptCloner());
    }

    // ========================= LABELS =========================

    @Test
    void addLabel_rejectsDuplicateName_andLeavesScriptUnchanged() {
        Script script = twoLabels();

        AddLabelResult result = synchronizer.addLabel("a", script);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getType()).isEqualTo(SyncErrorType.DUPLICATE_LABEL);
        assertThat(result.getError().getExistingNodeId()).isEqualTo("label-a");
        assertThat(script.getStatements()).hasSize(2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "1intro", "bad-name", "has space", "Intro"})
    void addLabel_rejectsMalformedName(String name) {
        Script script = twoLabels();

        AddLabelResult result = synchronizer.addLabel(name, script);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getType()).isEqualTo(SyncErrorType.INVALID_NAME);
        assertThat(script.getStatements()).hasSize(2);
    }

    @Test
    void addLabel_acceptsTwoDistinctNewNames() {
        Script script = twoLabels();

        AddLabelResult first = synchronizer.addLabel("chapter_2", script);
        AddLabelResult second = synchronizer.addLabel("_epilogue", script, List.of(dialogue("dlg-e", null, "The end.")));

        assertThat(first.isSuccess()).isTrue();
        assertThat(second.isSuccess()).isTrue();
        assertThat(first.getLabelId()).isNotBlank().isNotEqualTo(second.getLabelId());
        assertThat(script.getLabels()).extracting(LabelNode::getName)
                .containsExactly("a", "b", "chapter_2", "_epilogue");
        assertThat(script.findLabel("_epilogue").orElseThrow().getBody()).hasSize(1);
    }

    @Test
    void removeLabel_removesOnlyThatLabel() {
        Script script = twoLabels();

        assertThat(synchronizer.removeLabel("a", script)).isTrue();
        assertThat(synchronizer.removeLabel("missing", script)).isFalse();
        assertThat(script.getLabels()).extracting(LabelNode::getName).containsExactly("b");
    }

    // ========================= INSERTION =========================

    @Test
    void insertJumpIntoLabel_appendsJump_andRebuiltGraphShowsValidEdge() {
        Script script = twoLabels();

        String jumpId = synchronizer.insertJumpIntoLabel("a", "b", script);

        LabelNode a = script.findLabel("a").orElseThrow();
        assertThat(a.getBody()).hasSize(2);
        assertThat(a.getBody().get(1)).isInstanceOfSatisfying(JumpNode.class, jump -> {
            assertThat(jump.getId()).isEqualTo(jumpId);
            assertThat(jump.getTarget()).isEqualTo("b");
        });

        FlowGraph graph = graphBuilder.buildGraph(script);
        List<FlowEdge> jumpEdges = graph.getEdges().stream()
                .filter(edge -> edge.getType() == FlowEdgeType.JUMP)
                .toList();
        FlowNode jumpNode = graph.getNodes().stream()
                .filter(node -> node.getType() == FlowNodeType.JUMP)
                .findFirst()
                .orElseThrow();

        assertThat(jumpEdges).hasSize(1);
        assertThat(jumpEdges.get(0).isValid()).isTrue();
        assertThat(jumpEdges.get(0).getSource()).isEqualTo(jumpNode.getId());
        assertThat(jumpEdges.get(0).getTarget()).isEqualTo(graph.findEntryPoint("b").orElseThrow().getId());
        assertThat(jumpNode.getData().getAstNodeIds()).containsExactly(jumpId);
    }

    @Test
    void insertJumpIntoLabel_withNullAnchor_goesFirst() {
        Script script = twoLabels();

        String jumpId = synchronizer.insertJumpIntoLabel("a", "b", script, null);

        assertThat(script.findLabel("a").orElseThrow().getBody().get(0).getId()).isEqualTo(jumpId);
    }

    @Test
    void insertIntoMissingLabel_returnsNull_andLeavesScriptUnchanged() {
        Script script = twoLabels();
        Script before = synchronizer.cloneAst(script);

        assertThat(synchronizer.insertJumpIntoLabel("nowhere", "b", script)).isNull();
        assertThat(synchronizer.insertCallIntoLabel("nowhere", "b", script)).isNull();
        assertThat(synchronizer.insertDialogue("nowhere", DialogueData.builder().text("x").build(), script)).isNull();
        assertThat(script).isEqualTo(before);
    }

    @Test
    void insertDialogue_withoutAnchor_goesToIndexZero() {
        Script script = twoLabels();

        String id = synchronizer.insertDialogue("a",
                DialogueData.builder().speaker("eileen").text("First!").build(), script);

        List<ScriptNode> body = script.findLabel("a").orElseThrow().getBody();
        assertThat(body).extracting(ScriptNode::getId).containsExactly(id, "dlg-a");
        assertThat(body.get(0)).isInstanceOfSatisfying(DialogueNode.class, dialogue -> {
            assertThat(dialogue.getSpeaker()).isEqualTo("eileen");
            assertThat(dialogue.getText()).isEqualTo("First!");
            assertThat(dialogue.getRaw()).isNull();
        });
    }

    @Test
    void insertDialogue_afterAnchor_landsBetweenAnchorAndItsSuccessor() {
        Script script = script(label("label-a", "a",
                dialogue("d1", null, "one"),
                dialogue("d2", null, "two"),
                dialogue("d3", null, "three")));

        String id = synchronizer.insertDialogue("a", DialogueData.builder().text("one and a half").build(), script, "d1");

        assertThat(script.findLabel("a").orElseThrow().getBody())
                .extracting(ScriptNode::getId)
                .containsExactly("d1", id, "d2", "d3");
    }

    @Test
    void insertDialogue_afterNestedAnchor_staysInsideTheChoice() {
        Script script = menuScript();

        String id = synchronizer.insertDialogue("start", DialogueData.builder().text("Really.").build(), script, "dlg-stay");

        MenuNode menu = (MenuNode) walker.findById(script, "menu-1").orElseThrow();
        assertThat(menu.getChoices().get(1).getBody()).extracting(ScriptNode::getId).containsExactly("dlg-stay", id);
    }

    @Test
    void insertDialogue_withUnknownAnchor_appendsToBody() {
        Script script = twoLabels();

        String id = synchronizer.insertDialogue("a", DialogueData.builder().text("late").build(), script, "ghost");

        assertThat(script.findLabel("a").orElseThrow().getBody())
                .extracting(ScriptNode::getId)
                .containsExactly("dlg-a", id);
    }

    @Test
    void insertMenu_copiesChoices() {
        Script script = twoLabels();
        MenuData data = MenuData.builder()
                .prompt("Pick one")
                .choices(List.of(choice("Yes"), choice("No")))
                .build();

        String id = synchronizer.insertMenu("b", data, script, "dlg-b");

        ScriptNode inserted = script.findLabel("b").orElseThrow().getBody().get(1);
        assertThat(inserted.getId()).isEqualTo(id);
        assertThat(inserted).isInstanceOfSatisfying(MenuNode.class, menu -> {
            assertThat(menu.getPrompt()).isEqualTo("Pick one");
            assertThat(menu.getChoices()).extracting(MenuChoice::getText).containsExactly("Yes", "No");
        });
    }

    @Test
    void insertConditionAndReturn_landAfterTheirAnchors() {
        Script script = twoLabels();

        String ifId = synchronizer.insertCondition("a",
                List.of(branch("met_her", jump("jump-x", "b")), branch(null)), script, "dlg-a");
        String returnId = synchronizer.insertReturn("a", null, script, ifId);

        List<ScriptNode> body = script.findLabel("a").orElseThrow().getBody();
        assertThat(body).extracting(ScriptNode::getId).containsExactly("dlg-a", ifId, returnId);
        assertThat(body.get(1)).isInstanceOfSatisfying(IfNode.class, conditional -> {
            assertThat(conditional.getBranches()).extracting(IfBranch::getCondition).containsExactly("met_her", null);
            assertThat(conditional.getBranches().get(0).getBody()).hasSize(1);
        });
        assertThat(body.get(2).getKind()).isEqualTo(StatementKind.RETURN);
        assertThat(synchronizer.findNodeById(script, returnId)).isPresent();
    }

    @Test
    void insertStatement_intoPort_opensChoiceBody() {
        Script script = menuScript();
        InsertPosition position = InsertPosition.builder()
                .labelName("start")
                .parentNodeId("menu-1")
                .portIndex(1)
                .build();

        String id = synchronizer.insertStatement(position, dialogue("dlg-new", null, "Hm."), script);

        MenuNode menu = (MenuNode) walker.findById(script, "menu-1").orElseThrow();
        assertThat(id).isEqualTo("dlg-new");
        assertThat(menu.getChoices().get(1).getBody()).extracting(ScriptNode::getId)
                .containsExactly("dlg-new", "dlg-stay");
    }

    @Test
    void insertStatement_intoMissingPort_returnsNull() {
        Script script = menuScript();
        InsertPosition position = InsertPosition.builder()
                .labelName("start")
                .parentNodeId("menu-1")
                .portIndex(7)
                .build();

        assertThat(synchronizer.insertStatement(position, dialogue("dlg-new", null, "Hm."), script)).isNull();
    }

    @Test
    void insertJumpIntoChoice_retargetsExistingJump_insteadOfAddingSecond() {
        Script script = menuScript();

        boolean applied = synchronizer.insertJumpIntoChoice("menu-1", 0, "elsewhere", script);

        MenuNode menu = (MenuNode) walker.findById(script, "menu-1").orElseThrow();
        assertThat(applied).isTrue();
        assertThat(menu.getChoices().get(0).getBody()).singleElement()
                .isInstanceOfSatisfying(JumpNode.class, jump -> {
                    assertThat(jump.getId()).isEqualTo("jump-left");
                    assertThat(jump.getTarget()).isEqualTo("elsewhere");
                });
    }

    @Test
    void insertJumpIntoChoice_appendsJump_whenChoiceHasNone() {
        Script script = menuScript();

        assertThat(synchronizer.insertJumpIntoChoice("menu-1", 1, "left", script)).isTrue();

        MenuNode menu = (MenuNode) walker.findById(script, "menu-1").orElseThrow();
        List<ScriptNode> body = menu.getChoices().get(1).getBody();
        assertThat(body).hasSize(2);
        assertThat(body.get(1)).isInstanceOfSatisfying(JumpNode.class,
                jump -> assertThat(jump.getTarget()).isEqualTo("left"));
    }

    @Test
    void insertJumpIntoChoice_failsForOutOfRangeIndex_withoutChanges() {
        Script script = menuScript();
        Script before = synchronizer.cloneAst(script);

        assertThat(synchronizer.insertJumpIntoChoice("menu-1", 2, "left", script)).isFalse();
        assertThat(synchronizer.insertJumpIntoChoice("menu-1", -1, "left", script)).isFalse();
        assertThat(synchronizer.insertJumpIntoChoice("no-menu", 0, "left", script)).isFalse();
        assertThat(script).isEqualTo(before);
    }

    @Test
    void insertJumpIntoConditionBranch_mirrorsChoiceBehaviour() {
        Script script = script(
                label("label-a", "a", ifNode("if-1",
                        branch("points > 3", dialogue("dlg-win", null, "You win.")),
                        branch(null, jump("jump-lose", "lose")))),
                label("label-lose", "lose"));

        assertThat(synchronizer.insertJumpIntoConditionBranch("if-1", 0, "lose", script)).isTrue();
        assertThat(synchronizer.insertJumpIntoConditionBranch("if-1", 1, "a", script)).isTrue();
        assertThat(synchronizer.insertJumpIntoConditionBranch("if-1", 2, "a", script)).isFalse();

        IfNode conditional = (IfNode) walker.findById(script, "if-1").orElseThrow();
        assertThat(conditional.getBranches().get(0).getBody()).hasSize(2);
        assertThat(conditional.getBranches().get(1).getBody()).singleElement()
                .isInstanceOfSatisfying(JumpNode.class, jump -> assertThat(jump.getTarget()).isEqualTo("a"));
    }

    // ========================= DELETION =========================

    @Test
    void deleteNode_onEntryPoint_removesJumpsToIt_andLeavesOtherLabelsUntouched() {
        Script script = jumpChain();
        FlowGraph graph = graphBuilder.buildGraph(script);
        FlowNode b = graph.findEntryPoint("b").orElseThrow();

        DeleteResult result = synchronizer.deleteNode(b.getId(), graph, script);

        Script after = result.getScript();
        assertThat(after.getLabels()).extracting(LabelNode::getName).containsExactly("a", "c");
        assertThat(after.findLabel("a").orElseThrow().getBody()).extracting(ScriptNode::getId).containsExactly("dlg-a");
        assertThat(after.findLabel("c")).contains(script.findLabel("c").orElseThrow());
        assertThat(result.getRemovedStatementIds()).contains("jump-ab", "label-b");

        List<String> touching = graph.getEdges().stream()
                .filter(edge -> edge.touches(b.getId()))
                .map(FlowEdge::getId)
                .toList();
        assertThat(touching).isNotEmpty();
        assertThat(result.getRemovedEdgeIds()).containsExactlyInAnyOrderElementsOf(touching);

        // caller's script is untouched
        assertThat(script.getLabels()).hasSize(3);
    }

    @Test
    void deleteNode_onEntryPoint_removesNestedJumpsAndCalls() {
        Script script = script(
                label("label-start", "start",
                        menu("menu-1", null,
                                choice("Go", jump("jump-in-choice", "target")),
                                choice("Stay", dialogue("dlg-stay", null, "ok")))),
                label("label-other", "other",
                        ifNode("if-1", branch("flag", call("call-in-branch", "target"))),
                        jump("jump-top", "target")),
                label("label-target", "target", dialogue("dlg-t", null, "here")));
        FlowGraph graph = graphBuilder.buildGraph(script);

        DeleteResult result = synchronizer.deleteNode(graph.findEntryPoint("target").orElseThrow().getId(), graph, script);

        List<String> remainingTargets = new ArrayList<>();
        walker.forEach(result.getScript(), statement -> {
            if (statement instanceof JumpNode jump) remainingTargets.add(jump.getTarget());
            if (statement instanceof CallNode call) remainingTargets.add(call.getTarget());
        });
        assertThat(remainingTargets).doesNotContain("target");
        assertThat(result.getRemovedStatementIds())
                .contains("jump-in-choice", "call-in-branch", "jump-top", "label-target");
        assertThat(walker.findById(result.getScript(), "dlg-stay")).isPresent();
    }

    @Test
    void deleteNode_onMergedBlock_removesEveryStatementItCovers() {
        Script script = menuScript();
        FlowGraph graph = graphBuilder.buildGraph(script);
        FlowNode block = graph.getNodes().stream()
                .filter(node -> node.getType() == FlowNodeType.DIALOGUE_BLOCK)
                .filter(node -> node.getData().getAstNodeIds().contains("dlg-1"))
                .findFirst()
                .orElseThrow();

        DeleteResult result = synchronizer.deleteNode(block.getId(), graph, script);

        assertThat(result.getRemovedStatementIds()).containsExactlyInAnyOrder("scene-1", "dlg-1", "show-1", "dlg-2");
        assertThat(result.getScript().findLabel("start").orElseThrow().getBody())
                .extracting(ScriptNode::getId)
                .containsExactly("menu-1");
    }

    @Test
    void deleteNode_withUnknownId_returnsUnchangedCopy() {
        Script script = twoLabels();

        DeleteResult result = synchronizer.deleteNode("ghost", graphBuilder.buildGraph(script), script);

        assertThat(result.getScript()).isEqualTo(script).isNotSameAs(script);
        assertThat(result.getRemovedEdgeIds()).isEmpty();
        assertThat(result.getRemovedStatementIds()).isEmpty();
    }

    // ========================= CONNECTION REMOVAL =========================

    @Test
    void removeFlowStatement_removesOnlyTheRequestedKind() {
        Script script = script(
                label("label-a", "a", call("call-b", "b"), jump("jump-b", "b")),
                label("label-b", "b"));

        assertThat(synchronizer.removeFlowStatement("a", "b", script, StatementKind.CALL)).isTrue();
        assertThat(synchronizer.removeFlowStatement("a", "b", script, StatementKind.CALL)).isFalse();
        assertThat(synchronizer.removeFlowStatement("a", "b", script, StatementKind.DIALOGUE)).isFalse();

        assertThat(script.findLabel("a").orElseThrow().getBody()).extracting(ScriptNode::getId).containsExactly("jump-b");
    }

    @Test
    void removeFlowStatement_leavesJumpsNestedInBranchesAlone() {
        Script script = script(
                label("label-a", "a",
                        ifNode("if-x", branch("x", jump("jump-in-if", "b"))),
                        jump("jump-end", "b")),
                label("label-b", "b"));

        assertThat(synchronizer.removeFlowStatement("a", "b", script, StatementKind.JUMP)).isTrue();
        assertThat(synchronizer.removeFlowStatement("a", "b", script, StatementKind.JUMP)).isFalse();

        assertThat(walker.findById(script, "jump-end")).isEmpty();
        assertThat(walker.findById(script, "jump-in-if")).isPresent();
    }

    @Test
    void removeJumpFromChoice_undoesInsertJumpIntoChoice() {
        Script script = menuScript();
        Script before = synchronizer.cloneAst(script);

        synchronizer.insertJumpIntoChoice("menu-1", 1, "left", script);
        boolean removed = synchronizer.removeJumpFromChoice("menu-1", 1, "left", script);

        assertThat(removed).isTrue();
        assertThat(script).isEqualTo(before);
        assertThat(synchronizer.removeJumpFromChoice("menu-1", 1, "left", script)).isFalse();
    }

    @Test
    void removeJumpFromConditionBranch_removesMatchingJumpOnly() {
        Script script = script(label("label-a", "a",
                ifNode("if-1", branch("x", jump("jump-x", "b")), branch(null, jump("jump-else", "c")))));

        assertThat(synchronizer.removeJumpFromConditionBranch("if-1", 0, "c", script)).isFalse();
        assertThat(synchronizer.removeJumpFromConditionBranch("if-1", 0, "b", script)).isTrue();

        IfNode conditional = (IfNode) walker.findById(script, "if-1").orElseThrow();
        assertThat(conditional.getBranches().get(0).getBody()).isEmpty();
        assertThat(conditional.getBranches().get(1).getBody()).hasSize(1);
    }

    // ========================= UPDATES =========================

    @Test
    void updateOperations_changeTheAddressedStatement() {
        Script script = menuScript();

        assertThat(synchronizer.updateDialogueText("dlg-1", "Hi!", script)).isTrue();
        assertThat(synchronizer.updateDialogueSpeaker("dlg-2", "narrator", script)).isTrue();
        assertThat(synchronizer.updateFlowTarget("jump-left", "start", script)).isTrue();
        assertThat(synchronizer.updateChoiceText("menu-1", 1, "Wait here", script)).isTrue();
        assertThat(synchronizer.updateChoiceText("menu-1", 9, "nope", script)).isFalse();
        assertThat(synchronizer.updateFlowTarget("dlg-1", "start", script)).isFalse();
        assertThat(synchronizer.updateDialogueText("ghost", "x", script)).isFalse();

        assertThat(((DialogueNode) walker.findById(script, "dlg-1").orElseThrow()).getText()).isEqualTo("Hi!");
        assertThat(((DialogueNode) walker.findById(script, "dlg-2").orElseThrow()).getSpeaker()).isEqualTo("narrator");
        assertThat(((JumpNode) walker.findById(script, "jump-left").orElseThrow()).getTarget()).isEqualTo("start");
        assertThat(((MenuNode) walker.findById(script, "menu-1").orElseThrow()).getChoices().get(1).getText())
                .isEqualTo("Wait here");
    }

    // ========================= GRAPH → TREE SYNC =========================

    @Test
    void syncToAst_pushesEditedDialogueIntoCopy() {
        Script script = twoLabels();
        FlowGraph graph = graphBuilder.buildGraph(script);
        graph.getNodes().stream()
                .filter(node -> node.getType() == FlowNodeType.DIALOGUE_BLOCK)
                .flatMap(node -> node.getData().getDialogues().stream())
                .filter(item -> item.getId().equals("dlg-a"))
                .forEach(item -> {
                    item.setText("hello");
                    item.setSpeaker("eileen");
                });

        SyncResult result = synchronizer.syncToAst(graph, script);

        assertThat(result.isModified()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        DialogueNode synced = (DialogueNode) walker.findById(result.getScript(), "dlg-a").orElseThrow();
        assertThat(synced.getText()).isEqualTo("hello");
        assertThat(synced.getSpeaker()).isEqualTo("eileen");
        assertThat(((DialogueNode) walker.findById(script, "dlg-a").orElseThrow()).getText()).isEqualTo("hi");
    }

    @Test
    void syncToAst_retargetsJump_andReportsUnknownTarget() {
        Script script = jumpChain();
        FlowGraph graph = graphBuilder.buildGraph(script);
        FlowNode jumpNode = graph.getNodes().stream()
                .filter(node -> node.getType() == FlowNodeType.JUMP && "b".equals(node.getData().getTarget()))
                .findFirst()
                .orElseThrow();
        jumpNode.getData().setTarget("c");
        graph.getEdges().add(FlowEdge.builder()
                .id("e-dangling")
                .source(jumpNode.getId())
                .type(FlowEdgeType.JUMP)
                .targetLabel("missing")
                .targetState(EdgeTargetState.UNRESOLVED)
                .build());

        SyncResult result = synchronizer.syncToAst(graph, script);

        assertThat(((JumpNode) walker.findById(result.getScript(), "jump-ab").orElseThrow()).getTarget()).isEqualTo("c");
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getType()).isEqualTo(SyncErrorType.INVALID_TARGET);
            assertThat(error.getNodeId()).isEqualTo(jumpNode.getId());
        });
    }

    @Test
    void syncToAst_isolatesFailureToTheOffendingNode() {
        Script script = twoLabels();
        FlowGraph graph = graphBuilder.buildGraph(script);
        graph.getNodes().stream()
                .filter(node -> node.getType() == FlowNodeType.DIALOGUE_BLOCK)
                .flatMap(node -> node.getData().getDialogues().stream())
                .filter(item -> item.getId().equals("dlg-b"))
                .forEach(item -> item.setText("goodbye"));
        graph.getNodes().add(0, FlowNode.builder()
                .id("broken")
                .type(FlowNodeType.DIALOGUE_BLOCK)
                .data(FlowNodeData.builder().dialogues(Arrays.asList((DialogueItem) null)).build())
                .build());

        SyncResult result = synchronizer.syncToAst(graph, script);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getType()).isEqualTo(SyncErrorType.SYNC_FAILED);
            assertThat(error.getNodeId()).isEqualTo("broken");
        });
        assertThat(result.isModified()).isTrue();
        assertThat(((DialogueNode) walker.findById(result.getScript(), "dlg-b").orElseThrow()).getText()).isEqualTo("goodbye");
    }

    // ========================= TRIVIA & MERGE =========================

    @Test
    void preserveRawContent_restoresTriviaOnlyForKnownStatements() {
        Script original = twoLabels();
        walker.forEach(original, statement -> {
            statement.setRaw("raw:" + statement.getId());
            statement.setLine(7);
        });
        Script modified = synchronizer.cloneAst(original);
        walker.forEach(modified, statement -> {
            statement.setRaw(null);
            statement.setLine(null);
        });
        synchronizer.insertDialogue("a", DialogueData.builder().text("new").build(), modified);

        Script result = synchronizer.preserveRawContent(original, modified);

        assertThat(walker.findById(result, "dlg-b").orElseThrow().getRaw()).isEqualTo("raw:dlg-b");
        assertThat(walker.findById(result, "label-a").orElseThrow().getLine()).isEqualTo(7);
        ScriptNode added = result.findLabel("a").orElseThrow().getBody().get(0);
        assertThat(added.getRaw()).isNull();
        assertThat(added.getLine()).isNull();
    }

    @Test
    void getModifiedNodeIds_reportsAddedRemovedAndChanged() {
        Script original = twoLabels();
        Script modified = synchronizer.cloneAst(original);
        synchronizer.updateDialogueText("dlg-b", "farewell", modified);
        String added = synchronizer.insertDialogue("a", DialogueData.builder().text("new").build(), modified);
        synchronizer.removeLabel("b", modified);
        synchronizer.addLabel("c", modified);

        Set<String> ids = synchronizer.getModifiedNodeIds(original, modified);

        assertThat(ids).contains(added, "label-a", "label-b", "dlg-b");
        assertThat(ids).doesNotContain("dlg-a");
        assertThat(synchronizer.isNodeModified("dlg-a", original, modified)).isFalse();
        assertThat(synchronizer.isNodeModified("label-a", original, modified)).isTrue();
    }

    @Test
    void mergeAstChanges_appliesOnlyTheDifference_andKeepsTriviaOfUntouchedStatements() {
        Script original = twoLabels();
        walker.forEach(original, statement -> statement.setRaw("raw:" + statement.getId()));

        Script modified = synchronizer.cloneAst(original);
        DialogueNode edited = (DialogueNode) walker.findById(modified, "dlg-b").orElseThrow();
        edited.setText("farewell");
        edited.setRaw(null);
        LabelNode a = modified.findLabel("a").orElseThrow();
        a.getBody().clear();
        a.getBody().add(dialogue("dlg-a2", null, "replacement"));
        modified.getStatements().add(label("label-c", "c", dialogue("dlg-c", null, "new scene")));

        Script merged = synchronizer.mergeAstChanges(original, modified);

        assertThat(merged.getLabels()).extracting(LabelNode::getName).containsExactly("a", "b", "c");
        assertThat(merged.findLabel("a").orElseThrow().getBody()).extracting(ScriptNode::getId).containsExactly("dlg-a2");
        DialogueNode mergedB = (DialogueNode) walker.findById(merged, "dlg-b").orElseThrow();
        assertThat(mergedB.getText()).isEqualTo("farewell");
        assertThat(mergedB.getRaw()).isNull();
        assertThat(walker.findById(merged, "label-b").orElseThrow().getRaw()).isEqualTo("raw:label-b");
        assertThat(walker.findById(merged, "dlg-c")).isPresent();
    }

    @Test
    void cloneAst_isIndependentOfTheSource() {
        Script script = menuScript();

        Script copy = synchronizer.cloneAst(script);
        synchronizer.updateDialogueText("dlg-stay", "changed", copy);
        synchronizer.insertJumpIntoLabel("left", "start", copy);

        assertThat(copy).isNotEqualTo(script);
        assertThat(((DialogueNode) walker.findById(script, "dlg-stay").orElseThrow()).getText()).isEqualTo("Fine, we stay.");
        assertThat(script.findLabel("left").orElseThrow().getBody()).hasSize(2);
    }
}
