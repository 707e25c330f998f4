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
 * Subroutine call into another entry point; control comes back on return.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CallNode extends ScriptNode {

    private String target;

    @Builder.Default
    private List<String> arguments = new ArrayList<>();

    private boolean expression;

    @Override
    public StatementKind getKind() {
        return StatementKind.CALL;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
