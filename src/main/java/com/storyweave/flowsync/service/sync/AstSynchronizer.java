package com.storyweave.flowsync.service.sync;

import com.storyweave.flowsync.dto.graph.*;
import com.storyweave.flowsync.dto.sync.*;
import com.storyweave.flowsync.model.script.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Writes graph-side edits back into the script tree.
 *
 * {@link #syncToAst}, {@link #deleteNode} and {@link #mergeAstChanges} work on a clone and return it.
 * The insert, label and update operations mutate the script they are given, which the caller owns
 * (usually a clone obtained from {@link #cloneAst}). No operation throws for absent statements or labels;
 * failures come back as null, false or a typed result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AstSynchronizer {

    private static final Pattern LABEL_NAME_PATTERN = Pattern.compile("^[a-z_][a-z0-9_]*$");

    private final ScriptTreeWalker walker;
    private final ScriptCloner cloner;
    private final ScriptNodeFactory nodeFactory;

    public Script cloneAst(Script script) {
        return cloner.cloneScript(script);
    }

    public Optional<ScriptNode> findNodeById(Script script, String nodeId) {
        return walker.findById(script, nodeId);
    }

    // ========================= GRAPH → TREE SYNC =========================

    /**
     * Pushes edits made on graph node data (jump/call targets, dialogue lines, choice texts,
     * branch conditions) into a clone of the script, and reports jump/call edges whose target
     * entry point does not exist. A failure on one node is reported and the others still sync.
     */
    public SyncResult syncToAst(FlowGraph graph, Script original) {
        Script script = cloneAst(original);
        Map<String, ScriptNode> index = walker.indexById(script);
        List<SyncError> errors = new ArrayList<>();
        boolean modified = false;

        for (FlowNode node : graph.getNodes()) {
            try {
                if (syncFlowNode(node, index)) {
                    modified = true;
                }
            } catch (RuntimeException e) {
                log.error("Failed to sync graph node {}: {}", node.getId(), e.getMessage(), e);
                errors.add(SyncError.of(SyncErrorType.SYNC_FAILED,
                        "Failed to sync node: " + e.getMessage(), node.getId()));
            }
        }

        errors.addAll(validateFlowEdges(graph, script));
        log.debug("Synced graph into script: modified={}, errors={}", modified, errors.size());

        return SyncResult.builder()
                .script(script)
                .modified(modified)
                .errors(errors)
                .build();
    }

    private boolean syncFlowNode(FlowNode node, Map<String, ScriptNode> index) {
        FlowNodeData data = node.getData();
        if (data == null || node.getType() == null) {
            return false;
        }
        return switch (node.getType()) {
            case JUMP, CALL -> syncFlowTarget(data, index);
            case DIALOGUE_BLOCK -> syncDialogues(data, index);
            case MENU -> syncChoices(data, index);
            case CONDITION -> syncBranches(data, index);
            case SCENE, RETURN -> false;
        };
    }

    private boolean syncFlowTarget(FlowNodeData data, Map<String, ScriptNode> index) {
        if (data.getTarget() == null || data.getTarget().isBlank()) {
            return false;
        }
        boolean changed = false;
        for (String id : data.constituentIds()) {
            ScriptNode statement = index.get(id);
            if (statement instanceof JumpNode jump && !data.getTarget().equals(jump.getTarget())) {
                jump.setTarget(data.getTarget());
                changed = true;
            } else if (statement instanceof CallNode call && !data.getTarget().equals(call.getTarget())) {
                call.setTarget(data.getTarget());
                changed = true;
            }
        }
        return changed;
    }

    private boolean syncDialogues(FlowNodeData data, Map<String, ScriptNode> index) {
        if (data.getDialogues() == null) {
            return false;
        }
        boolean changed = false;
        for (DialogueItem item : data.getDialogues()) {
            if (!(index.get(item.getId()) instanceof DialogueNode dialogue)) {
                continue;
            }
            if (!Objects.equals(item.getSpeaker(), dialogue.getSpeaker())) {
                dialogue.setSpeaker(item.getSpeaker());
                changed = true;
            }
            if (item.getText() != null && !item.getText().equals(dialogue.getText())) {
                dialogue.setText(item.getText());
                changed = true;
            }
        }
        return changed;
    }

    private boolean syncChoices(FlowNodeData data, Map<String, ScriptNode> index) {
        MenuNode menu = findConstituent(data, index, MenuNode.class);
        if (menu == null || data.getChoices() == null) {
            return false;
        }
        boolean changed = false;
        int count = Math.min(menu.getChoices().size(), data.getChoices().size());
        for (int i = 0; i < count; i++) {
            String text = data.getChoices().get(i).getText();
            MenuChoice choice = menu.getChoices().get(i);
            if (text != null && !text.equals(choice.getText())) {
                choice.setText(text);
                changed = true;
            }
        }
        return changed;
    }

    private boolean syncBranches(FlowNodeData data, Map<String, ScriptNode> index) {
        IfNode conditional = findConstituent(data, index, IfNode.class);
        if (conditional == null || data.getBranches() == null) {
            return false;
        }
        boolean changed = false;
        int count = Math.min(conditional.getBranches().size(), data.getBranches().size());
        for (int i = 0; i < count; i++) {
            String condition = data.getBranches().get(i).getCondition();
            IfBranch branch = conditional.getBranches().get(i);
            if (!Objects.equals(condition, branch.getCondition())) {
                branch.setCondition(condition);
                changed = true;
            }
        }
        return changed;
    }

    private <T extends ScriptNode> T findConstituent(FlowNodeData data, Map<String, ScriptNode> index, Class<T> type) {
        for (String id : data.constituentIds()) {
            ScriptNode statement = index.get(id);
            if (type.isInstance(statement)) {
                return type.cast(statement);
            }
        }
        return null;
    }

    private List<SyncError> validateFlowEdges(FlowGraph graph, Script script) {
        Set<String> labelNames = collectLabelNames(script);
        List<SyncError> errors = new ArrayList<>();
        for (FlowEdge edge : graph.getEdges()) {
            if (edge.getType() == null || !edge.getType().isFlowTransfer()) {
                continue;
            }
            String targetLabel = edge.getTargetLabel();
            if (targetLabel == null && edge.getTarget() != null) {
                targetLabel = graph.findNode(edge.getTarget())
                        .map(FlowNode::getData)
                        .map(FlowNodeData::getLabel)
                        .orElse(null);
            }
            if (targetLabel == null || !labelNames.contains(targetLabel)) {
                errors.add(SyncError.of(SyncErrorType.INVALID_TARGET,
                        "Jump target does not exist: " + targetLabel, edge.getSource()));
            }
        }
        return errors;
    }

    // ========================= DELETION =========================

    /**
     * Removes the statements a graph node stands for. Deleting an entry point also removes every
     * jump and call anywhere in the script that targets it.
     */
    public DeleteResult deleteNode(String graphNodeId, FlowGraph graph, Script original) {
        Script script = cloneAst(original);
        Optional<FlowNode> found = graph.findNode(graphNodeId);
        if (found.isEmpty()) {
            log.debug("Graph node {} not found, nothing to delete", graphNodeId);
            return DeleteResult.builder().script(script).build();
        }
        FlowNode node = found.get();

        List<String> removedStatementIds = new ArrayList<>();
        if (node.isEntryPoint() && node.getData() != null && node.getData().getLabel() != null) {
            String labelName = node.getData().getLabel();
            removedStatementIds.addAll(walker.removeMatching(script.getStatements(), flowTransferTo(labelName)));
        }

        Set<String> constituentIds = node.getData() != null
                ? new HashSet<>(node.getData().constituentIds())
                : Set.of();
        if (!constituentIds.isEmpty()) {
            removedStatementIds.addAll(walker.removeMatching(script.getStatements(),
                    statement -> constituentIds.contains(statement.getId())));
        }

        Set<String> remainingEdgeIds = new HashSet<>();
        graph.getEdges().stream()
                .filter(edge -> !edge.touches(graphNodeId))
                .forEach(edge -> remainingEdgeIds.add(edge.getId()));
        List<String> removedEdgeIds = graph.getEdges().stream()
                .map(FlowEdge::getId)
                .filter(id -> !remainingEdgeIds.contains(id))
                .toList();

        log.info("Deleted graph node {}: {} statements, {} edges removed",
                graphNodeId, removedStatementIds.size(), removedEdgeIds.size());

        return DeleteResult.builder()
                .script(script)
                .removedEdgeIds(new ArrayList<>(removedEdgeIds))
                .removedStatementIds(removedStatementIds)
                .build();
    }

    private static Predicate<ScriptNode> flowTransferTo(String labelName) {
        return statement -> (statement instanceof JumpNode jump && labelName.equals(jump.getTarget()))
                || (statement instanceof CallNode call && labelName.equals(call.getTarget()));
    }

    // ========================= INSERTION =========================

    public String insertDialogue(String labelName, DialogueData data, Script script) {
        return insertDialogue(labelName, data, script, null);
    }

    /**
     * Inserts a dialogue line right after {@code afterNodeId}, or first in the body when it is null.
     *
     * @return id of the new statement, or null when the label does not exist
     */
    public String insertDialogue(String labelName, DialogueData data, Script script, String afterNodeId) {
        return insertIntoLabel(labelName, nodeFactory.createDialogue(data), script, afterNodeId, false);
    }

    public String insertMenu(String labelName, MenuData data, Script script) {
        return insertMenu(labelName, data, script, null);
    }

    public String insertMenu(String labelName, MenuData data, Script script, String afterNodeId) {
        return insertIntoLabel(labelName, nodeFactory.createMenu(data), script, afterNodeId, false);
    }

    public String insertCondition(String labelName, List<IfBranch> branches, Script script, String afterNodeId) {
        return insertIntoLabel(labelName, nodeFactory.createCondition(branches), script, afterNodeId, false);
    }

    public String insertReturn(String labelName, String value, Script script, String afterNodeId) {
        return insertIntoLabel(labelName, nodeFactory.createReturn(value), script, afterNodeId, false);
    }

    /**
     * Appends a jump at the end of the label body.
     */
    public String insertJumpIntoLabel(String labelName, String targetLabel, Script script) {
        return insertIntoLabel(labelName, nodeFactory.createJump(targetLabel), script, null, true);
    }

    /**
     * Inserts a jump right after {@code afterNodeId}, or first in the body when it is null.
     */
    public String insertJumpIntoLabel(String labelName, String targetLabel, Script script, String afterNodeId) {
        return insertIntoLabel(labelName, nodeFactory.createJump(targetLabel), script, afterNodeId, false);
    }

    public String insertCallIntoLabel(String labelName, String targetLabel, Script script) {
        return insertIntoLabel(labelName, nodeFactory.createCall(targetLabel, null), script, null, true);
    }

    public String insertCallIntoLabel(String labelName, String targetLabel, Script script, String afterNodeId) {
        return insertIntoLabel(labelName, nodeFactory.createCall(targetLabel, null), script, afterNodeId, false);
    }

    /**
     * Places an already built statement at a resolved position: either into a label body after an anchor,
     * or at the start of one choice/branch body of a menu or conditional.
     *
     * @return id of the statement, or null when the position cannot be resolved in this script
     */
    public String insertStatement(InsertPosition position, ScriptNode statement, Script script) {
        if (position == null || statement == null) {
            return null;
        }
        if (position.isPortInsertion()) {
            List<ScriptNode> body = findPortBody(script, position.getParentNodeId(), position.getPortIndex());
            if (body == null) {
                log.warn("Cannot insert into port {} of {}: no such choice or branch",
                        position.getPortIndex(), position.getParentNodeId());
                return null;
            }
            body.add(0, statement);
            log.debug("Inserted {} at start of port {} of {}", statement.getId(), position.getPortIndex(),
                    position.getParentNodeId());
            return statement.getId();
        }
        return insertIntoLabel(position.getLabelName(), statement, script, position.getAfterNodeId(), false);
    }

    private String insertIntoLabel(String labelName, ScriptNode statement, Script script,
                                   String afterNodeId, boolean appendWhenUnanchored) {
        Optional<LabelNode> label = script.findLabel(labelName);
        if (label.isEmpty()) {
            log.warn("Cannot insert {} into missing label: {}", statement.getKind().getCode(), labelName);
            return null;
        }
        List<ScriptNode> body = label.get().getBody();

        if (afterNodeId == null) {
            if (appendWhenUnanchored) {
                body.add(statement);
            } else {
                body.add(0, statement);
            }
        } else if (!walker.insertAfter(body, afterNodeId, statement)) {
            log.debug("Anchor {} not found in label {}, appending", afterNodeId, labelName);
            body.add(statement);
        }

        log.debug("Inserted {} {} into label {}", statement.getKind().getCode(), statement.getId(), labelName);
        return statement.getId();
    }

    private List<ScriptNode> findPortBody(Script script, String parentId, int portIndex) {
        Optional<ScriptNode> parent = walker.findById(script, parentId);
        if (parent.isEmpty()) {
            return null;
        }
        List<List<ScriptNode>> bodies = walker.childBodies(parent.get());
        if (parent.get() instanceof LabelNode || portIndex < 0 || portIndex >= bodies.size()) {
            return null;
        }
        return bodies.get(portIndex);
    }

    /**
     * Points a menu choice at an entry point. An existing jump in the choice body is retargeted,
     * so a choice never ends up with two jumps.
     */
    public boolean insertJumpIntoChoice(String menuId, int choiceIndex, String targetLabel, Script script) {
        if (!(walker.findById(script, menuId).orElse(null) instanceof MenuNode menu)) {
            log.warn("Menu not found: {}", menuId);
            return false;
        }
        if (choiceIndex < 0 || choiceIndex >= menu.getChoices().size()) {
            log.warn("Choice index {} out of range for menu {}", choiceIndex, menuId);
            return false;
        }
        return setJumpInBody(menu.getChoices().get(choiceIndex).getBody(), targetLabel);
    }

    public boolean insertJumpIntoConditionBranch(String conditionId, int branchIndex, String targetLabel, Script script) {
        if (!(walker.findById(script, conditionId).orElse(null) instanceof IfNode conditional)) {
            log.warn("Condition not found: {}", conditionId);
            return false;
        }
        if (branchIndex < 0 || branchIndex >= conditional.getBranches().size()) {
            log.warn("Branch index {} out of range for condition {}", branchIndex, conditionId);
            return false;
        }
        return setJumpInBody(conditional.getBranches().get(branchIndex).getBody(), targetLabel);
    }

    private boolean setJumpInBody(List<ScriptNode> body, String targetLabel) {
        for (ScriptNode statement : body) {
            if (statement instanceof JumpNode jump) {
                jump.setTarget(targetLabel);
                return true;
            }
        }
        body.add(nodeFactory.createJump(targetLabel));
        return true;
    }

    // ========================= LABELS =========================

    public AddLabelResult addLabel(String name, Script script) {
        return addLabel(name, script, null);
    }

    /**
     * Appends a new entry point after validating the name and its uniqueness.
     */
    public AddLabelResult addLabel(String name, Script script, List<ScriptNode> body) {
        SyncError nameError = validateLabelName(name);
        if (nameError != null) {
            log.warn("Rejected label name '{}': {}", name, nameError.getMessage());
            return AddLabelResult.failed(nameError);
        }

        Optional<LabelNode> existing = findAnyLabel(script, name);
        if (existing.isPresent()) {
            log.warn("Rejected duplicate label: {}", name);
            return AddLabelResult.failed(SyncError.builder()
                    .type(SyncErrorType.DUPLICATE_LABEL)
                    .message("Label already exists: " + name)
                    .existingNodeId(existing.get().getId())
                    .build());
        }

        LabelNode label = nodeFactory.createLabel(name, body);
        script.getStatements().add(label);
        log.debug("Added label {} ({})", name, label.getId());
        return AddLabelResult.added(label.getId());
    }

    public SyncError validateLabelName(String name) {
        if (name == null || name.isBlank()) {
            return SyncError.of(SyncErrorType.INVALID_NAME, "Label name cannot be empty");
        }
        if (Character.isDigit(name.charAt(0))) {
            return SyncError.of(SyncErrorType.INVALID_NAME, "Label name cannot start with a digit: " + name);
        }
        if (!LABEL_NAME_PATTERN.matcher(name).matches()) {
            return SyncError.of(SyncErrorType.INVALID_NAME,
                    "Label name may only contain lowercase letters, digits and underscores: " + name);
        }
        return null;
    }

    public boolean removeLabel(String name, Script script) {
        Optional<LabelNode> label = script.findLabel(name);
        label.ifPresent(l -> script.getStatements().remove(l));
        return label.isPresent();
    }

    private Optional<LabelNode> findAnyLabel(Script script, String name) {
        List<LabelNode> found = new ArrayList<>();
        walker.forEach(script, statement -> {
            if (statement instanceof LabelNode label && name.equals(label.getName())) {
                found.add(label);
            }
        });
        return found.stream().findFirst();
    }

    private Set<String> collectLabelNames(Script script) {
        Set<String> names = new HashSet<>();
        script.getLabels().forEach(label -> names.add(label.getName()));
        return names;
    }

    // ========================= UPDATES =========================

    public boolean updateDialogueText(String dialogueId, String text, Script script) {
        if (!(walker.findById(script, dialogueId).orElse(null) instanceof DialogueNode dialogue)) {
            return false;
        }
        dialogue.setText(text);
        return true;
    }

    public boolean updateDialogueSpeaker(String dialogueId, String speaker, Script script) {
        if (!(walker.findById(script, dialogueId).orElse(null) instanceof DialogueNode dialogue)) {
            return false;
        }
        dialogue.setSpeaker(speaker);
        return true;
    }

    /**
     * Retargets a jump or call statement.
     */
    public boolean updateFlowTarget(String statementId, String targetLabel, Script script) {
        ScriptNode statement = walker.findById(script, statementId).orElse(null);
        if (statement instanceof JumpNode jump) {
            jump.setTarget(targetLabel);
            return true;
        }
        if (statement instanceof CallNode call) {
            call.setTarget(targetLabel);
            return true;
        }
        return false;
    }

    public boolean updateChoiceText(String menuId, int choiceIndex, String text, Script script) {
        if (!(walker.findById(script, menuId).orElse(null) instanceof MenuNode menu)
                || choiceIndex < 0 || choiceIndex >= menu.getChoices().size()) {
            return false;
        }
        menu.getChoices().get(choiceIndex).setText(text);
        return true;
    }

    // ========================= CONNECTION REMOVAL =========================

    /**
     * Removes the first jump or call to {@code targetLabel} from the label's own body.
     * Statements nested in choice or branch bodies are left alone.
     */
    public boolean removeFlowStatement(String labelName, String targetLabel, Script script, StatementKind kind) {
        if (kind == null || !kind.isFlowTransfer() || targetLabel == null) {
            return false;
        }
        Optional<LabelNode> label = script.findLabel(labelName);
        if (label.isEmpty()) {
            return false;
        }
        Predicate<ScriptNode> matches = flowTransferTo(targetLabel);
        Iterator<ScriptNode> statements = label.get().getBody().iterator();
        while (statements.hasNext()) {
            ScriptNode statement = statements.next();
            if (statement.getKind() == kind && matches.test(statement)) {
                statements.remove();
                log.debug("Removed {} to {} from label {}", kind.getCode(), targetLabel, labelName);
                return true;
            }
        }
        return false;
    }

    /**
     * Removes one statement by id, wherever it is nested.
     */
    public boolean removeStatement(String statementId, Script script) {
        return walker.removeById(script, statementId);
    }

    /**
     * Removes the jump from a choice body. A null target removes whichever jump is there.
     */
    public boolean removeJumpFromChoice(String menuId, int choiceIndex, String targetLabel, Script script) {
        if (!(walker.findById(script, menuId).orElse(null) instanceof MenuNode menu)
                || choiceIndex < 0 || choiceIndex >= menu.getChoices().size()) {
            return false;
        }
        return removeJump(menu.getChoices().get(choiceIndex).getBody(), targetLabel);
    }

    public boolean removeJumpFromConditionBranch(String conditionId, int branchIndex, String targetLabel, Script script) {
        if (!(walker.findById(script, conditionId).orElse(null) instanceof IfNode conditional)
                || branchIndex < 0 || branchIndex >= conditional.getBranches().size()) {
            return false;
        }
        return removeJump(conditional.getBranches().get(branchIndex).getBody(), targetLabel);
    }

    private boolean removeJump(List<ScriptNode> body, String targetLabel) {
        return body.removeIf(statement -> statement instanceof JumpNode jump
                && (targetLabel == null || targetLabel.equals(jump.getTarget())));
    }

    // ========================= TRIVIA & MERGE =========================

    /**
     * Copy of {@code modified} where statements that also exist in {@code original} get back
     * their source line and raw text when they lost them.
     */
    public Script preserveRawContent(Script original, Script modified) {
        Script result = cloneAst(modified);
        Map<String, ScriptNode> originals = walker.indexById(original);
        walker.forEach(result, statement -> {
            ScriptNode source = originals.get(statement.getId());
            if (source != null) {
                restoreTrivia(source, statement);
            }
        });
        return result;
    }

    /**
     * Ids of statements added, removed or changed between two versions of a script. A changed statement
     * also marks every statement containing it as changed.
     */
    public Set<String> getModifiedNodeIds(Script original, Script modified) {
        Map<String, ScriptNode> originals = walker.indexById(original);
        Map<String, ScriptNode> modifieds = walker.indexById(modified);
        Set<String> ids = new LinkedHashSet<>();
        modifieds.forEach((id, statement) -> {
            if (!statement.equals(originals.get(id))) {
                ids.add(id);
            }
        });
        originals.keySet().stream()
                .filter(id -> !modifieds.containsKey(id))
                .forEach(ids::add);
        return ids;
    }

    public boolean isNodeModified(String nodeId, Script original, Script modified) {
        ScriptNode before = walker.findById(original, nodeId).orElse(null);
        ScriptNode after = walker.findById(modified, nodeId).orElse(null);
        return !Objects.equals(before, after);
    }

    /**
     * Applies only what changed in {@code modified} onto a copy of {@code original}: statements whose
     * own fields changed are replaced outermost first, removed statements are dropped, and added statements
     * go to their container and index from {@code modified}. Statements with unchanged content get their
     * trivia back.
     */
    public Script mergeAstChanges(Script original, Script modified) {
        Script result = cloneAst(original);
        Map<String, ScriptNode> originals = walker.indexById(original);
        Map<String, ScriptNode> modifieds = walker.indexById(modified);
        Map<String, String> owners = walker.ownerIndex(modified);
        List<String> order = walker.preorderIds(modified);

        Set<String> replaced = new HashSet<>();
        for (String id : order) {
            ScriptNode before = originals.get(id);
            if (before == null || hasReplacedOwner(id, owners, replaced)) {
                continue;
            }
            ScriptNode after = modifieds.get(id);
            if (!cloner.shallowCopy(before).equals(cloner.shallowCopy(after))) {
                walker.replace(result, id, cloner.clone(after));
                replaced.add(id);
            }
        }

        originals.keySet().stream()
                .filter(id -> !modifieds.containsKey(id))
                .forEach(id -> walker.removeById(result, id));

        Set<String> present = walker.collectIds(result);
        for (String id : order) {
            if (present.contains(id)) {
                continue;
            }
            ScriptNode copy = cloner.clone(modifieds.get(id));
            List<ScriptNode> target = containerIn(result, modified, id);
            NodeLocation location = walker.locate(modified, id).orElse(null);
            if (target == null || location == null) {
                result.getStatements().add(copy);
            } else {
                target.add(Math.min(location.index(), target.size()), copy);
            }
            present.addAll(walker.collectIds(copy));
        }

        // Trivia only comes back where the statement's own content is unchanged
        walker.forEach(result, statement -> {
            ScriptNode source = originals.get(statement.getId());
            if (source != null && sameContent(source, statement)) {
                restoreTrivia(source, statement);
            }
        });

        log.debug("Merged {} replaced statements into script", replaced.size());
        return result;
    }

    private boolean sameContent(ScriptNode a, ScriptNode b) {
        ScriptNode left = cloner.shallowCopy(a);
        ScriptNode right = cloner.shallowCopy(b);
        left.setRaw(null);
        left.setLine(null);
        right.setRaw(null);
        right.setLine(null);
        return left.equals(right);
    }

    private static void restoreTrivia(ScriptNode source, ScriptNode target) {
        if (target.getRaw() == null && source.getRaw() != null) {
            target.setRaw(source.getRaw());
        }
        if (target.getLine() == null && source.getLine() != null) {
            target.setLine(source.getLine());
        }
    }

    private boolean hasReplacedOwner(String id, Map<String, String> owners, Set<String> replaced) {
        String owner = owners.get(id);
        while (owner != null) {
            if (replaced.contains(owner)) {
                return true;
            }
            owner = owners.get(owner);
        }
        return false;
    }

    private List<ScriptNode> containerIn(Script result, Script modified, String id) {
        NodeLocation location = walker.locate(modified, id).orElse(null);
        if (location == null) {
            return null;
        }
        if (location.isTopLevel()) {
            return result.getStatements();
        }
        return walker.findById(result, location.ownerId())
                .map(walker::childBodies)
                .filter(bodies -> location.bodyIndex() < bodies.size())
                .map(bodies -> bodies.get(location.bodyIndex()))
                .orElse(null);
    }
}
