package com.storyweave.flowsync.model.script;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DialogueNode extends ScriptNode {

    /**
     * Null for narration.
     */
    private String speaker;
    private String text;

    @Builder.Default
    private List<String> attributes = new ArrayList<>();

    @Override
    public StatementKind getKind() {
        return StatementKind.DIALOGUE;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitDialogue(this);
    }
}
