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
public class PythonNode extends ScriptNode {

    private String code;
    private boolean early;
    private boolean hide;

    @Override
    public StatementKind getKind() {
        return StatementKind.PYTHON;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitPython(this);
    }
}
