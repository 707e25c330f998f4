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
public class PauseNode extends ScriptNode {

    private Double duration;

    @Override
    public StatementKind getKind() {
        return StatementKind.PAUSE;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitPause(this);
    }
}
