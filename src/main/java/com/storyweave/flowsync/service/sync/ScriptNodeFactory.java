package com.storyweave.flowsync.service.sync;

import com.storyweave.flowsync.dto.sync.DialogueData;
import com.storyweave.flowsync.dto.sync.MenuData;
import com.storyweave.flowsync.model.script.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Creates new script statements with fresh ids. New statements carry no line or raw text,
 * so the serializer regenerates their source.
 */
@Component
public class ScriptNodeFactory {

    public String newId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    public LabelNode createLabel(String name, List<ScriptNode> body) {
        return LabelNode.builder()
                .id(newId("label"))
                .name(name)
                .body(body != null ? new ArrayList<>(body) : new ArrayList<>())
                .build();
    }

    public DialogueNode createDialogue(DialogueData data) {
        return DialogueNode.builder()
                .id(newId("dialogue"))
                .speaker(data.getSpeaker())
                .text(data.getText() != null ? data.getText() : "")
                .attributes(data.getAttributes() != null ? new ArrayList<>(data.getAttributes()) : new ArrayList<>())
                .build();
    }

    public MenuNode createMenu(MenuData data) {
        List<MenuChoice> choices = new ArrayList<>();
        if (data.getChoices() != null) {
            for (MenuChoice choice : data.getChoices()) {
                choices.add(MenuChoice.builder()
                        .text(choice.getText())
                        .condition(choice.getCondition())
                        .body(choice.getBody() != null ? new ArrayList<>(choice.getBody()) : new ArrayList<>())
                        .build());
            }
        }
        return MenuNode.builder()
                .id(newId("menu"))
                .prompt(data.getPrompt())
                .choices(choices)
                .build();
    }

    public IfNode createCondition(List<IfBranch> branches) {
        List<IfBranch> copies = new ArrayList<>();
        if (branches != null) {
            for (IfBranch branch : branches) {
                copies.add(IfBranch.builder()
                        .condition(branch.getCondition())
                        .body(branch.getBody() != null ? new ArrayList<>(branch.getBody()) : new ArrayList<>())
                        .build());
            }
        }
        return IfNode.builder()
                .id(newId("if"))
                .branches(copies)
                .build();
    }

    public JumpNode createJump(String target) {
        return JumpNode.builder()
                .id(newId("jump"))
                .target(target)
                .expression(false)
                .build();
    }

    public CallNode createCall(String target, List<String> arguments) {
        return CallNode.builder()
                .id(newId("call"))
                .target(target)
                .arguments(arguments != null ? new ArrayList<>(arguments) : new ArrayList<>())
                .expression(false)
                .build();
    }

    public ReturnNode createReturn(String value) {
        return ReturnNode.builder()
                .id(newId("return"))
                .value(value)
                .build();
    }
}
