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
 * Conditional with ordered branches; the last branch may be an else (null condition).
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class IfNode extends ScriptNode {

    @Builder.Default
    private List<IfBranch> branches = new ArrayList<>();

    @Override
    public StatementKind getKind() {
        return StatementKind.IF;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
