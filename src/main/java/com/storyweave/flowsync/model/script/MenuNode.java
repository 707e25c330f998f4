package com.storyweave.flowsync.model.script;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Branching menu. Each choice owns its own body.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MenuNode extends ScriptNode {

    private String prompt;

    @Builder.Default
    private List<MenuChoice> choices = new ArrayList<>();

    @Override
    public StatementKind getKind() {
        return StatementKind.MENU;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitMenu(this);
    }
}
