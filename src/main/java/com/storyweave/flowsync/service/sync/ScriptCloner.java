package com.storyweave.flowsync.service.sync;

import com.storyweave.flowsync.model.script.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural copy of script trees.
 *
 * Every mutating operation works on a clone so the caller's script is never touched.
 * A shallow copy keeps a statement's own fields but leaves its child bodies empty; it is used
 * to tell whether a statement itself changed independently of what it contains.
 */
@Component
public class ScriptCloner {

    private final CopyVisitor deepCopy = new CopyVisitor(true);
    private final CopyVisitor shallowCopy = new CopyVisitor(false);

    public Script cloneScript(Script script) {
        if (script == null) return null;
        ScriptMetadata metadata = script.getMetadata();
        return Script.builder()
                .statements(cloneAll(script.getStatements()))
                .metadata(metadata == null ? null : ScriptMetadata.builder()
                        .filePath(metadata.getFilePath())
                        .parseTime(metadata.getParseTime())
                        .version(metadata.getVersion())
                        .build())
                .build();
    }

    public ScriptNode clone(ScriptNode node) {
        return node == null ? null : node.accept(deepCopy);
    }

    public ScriptNode shallowCopy(ScriptNode node) {
        return node == null ? null : node.accept(shallowCopy);
    }

    public List<ScriptNode> cloneAll(List<ScriptNode> nodes) {
        List<ScriptNode> copies = new ArrayList<>();
        if (nodes != null) {
            nodes.forEach(node -> copies.add(clone(node)));
        }
        return copies;
    }

    private final class CopyVisitor implements ScriptNodeVisitor<ScriptNode> {

        private final boolean deep;

        private CopyVisitor(boolean deep) {
            this.deep = deep;
        }

        private List<ScriptNode> body(List<ScriptNode> body) {
            return deep ? cloneAll(body) : new ArrayList<>();
        }

        private List<String> strings(List<String> values) {
            return values == null ? new ArrayList<>() : new ArrayList<>(values);
        }

        @Override
        public ScriptNode visitLabel(LabelNode node) {
            return LabelNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .name(node.getName())
                    .parameters(strings(node.getParameters()))
                    .body(body(node.getBody()))
                    .build();
        }

        @Override
        public ScriptNode visitDialogue(DialogueNode node) {
            return DialogueNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .speaker(node.getSpeaker())
                    .text(node.getText())
                    .attributes(strings(node.getAttributes()))
                    .build();
        }

        @Override
        public ScriptNode visitMenu(MenuNode node) {
            List<MenuChoice> choices = new ArrayList<>();
            for (MenuChoice choice : node.getChoices()) {
                choices.add(MenuChoice.builder()
                        .text(choice.getText())
                        .condition(choice.getCondition())
                        .body(body(choice.getBody()))
                        .build());
            }
            return MenuNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .prompt(node.getPrompt())
                    .choices(choices)
                    .build();
        }

        @Override
        public ScriptNode visitIf(IfNode node) {
            List<IfBranch> branches = new ArrayList<>();
            for (IfBranch branch : node.getBranches()) {
                branches.add(IfBranch.builder()
                        .condition(branch.getCondition())
                        .body(body(branch.getBody()))
                        .build());
            }
            return IfNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .branches(branches)
                    .build();
        }

        @Override
        public ScriptNode visitJump(JumpNode node) {
            return JumpNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .target(node.getTarget())
                    .expression(node.isExpression())
                    .build();
        }

        @Override
        public ScriptNode visitCall(CallNode node) {
            return CallNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .target(node.getTarget())
                    .arguments(strings(node.getArguments()))
                    .expression(node.isExpression())
                    .build();
        }

        @Override
        public ScriptNode visitReturn(ReturnNode node) {
            return ReturnNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .value(node.getValue())
                    .build();
        }

        @Override
        public ScriptNode visitScene(SceneNode node) {
            return SceneNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .image(node.getImage())
                    .layer(node.getLayer())
                    .build();
        }

        @Override
        public ScriptNode visitShow(ShowNode node) {
            return ShowNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .image(node.getImage())
                    .attributes(strings(node.getAttributes()))
                    .atPosition(node.getAtPosition())
                    .build();
        }

        @Override
        public ScriptNode visitHide(HideNode node) {
            return HideNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .image(node.getImage())
                    .build();
        }

        @Override
        public ScriptNode visitWith(WithNode node) {
            return WithNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .transition(node.getTransition())
                    .build();
        }

        @Override
        public ScriptNode visitSet(SetNode node) {
            return SetNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .variable(node.getVariable())
                    .operator(node.getOperator())
                    .value(node.getValue())
                    .build();
        }

        @Override
        public ScriptNode visitPython(PythonNode node) {
            return PythonNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .code(node.getCode())
                    .early(node.isEarly())
                    .hide(node.isHide())
                    .build();
        }

        @Override
        public ScriptNode visitPause(PauseNode node) {
            return PauseNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .duration(node.getDuration())
                    .build();
        }

        @Override
        public ScriptNode visitRaw(RawNode node) {
            return RawNode.builder()
                    .id(node.getId()).line(node.getLine()).raw(node.getRaw())
                    .content(node.getContent())
                    .build();
        }
    }
}
