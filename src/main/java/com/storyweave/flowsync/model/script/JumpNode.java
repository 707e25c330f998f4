package com.storyweave.flowsync.model.script;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class JumpNode extends ScriptNode {

    private String target;
    private boolean expression;

    @Override
    public StatementKind getKind() {
        return StatementKind.JUMP;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitJump(this);
    }
}
