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
 * Named entry point owning an ordered body. Jump and call statements target it by name.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class LabelNode extends ScriptNode {

    private String name;

    @Builder.Default
    private List<String> parameters = new ArrayList<>();

    @Builder.Default
    private List<ScriptNode> body = new ArrayList<>();

    @Override
    public StatementKind getKind() {
        return StatementKind.LABEL;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitLabel(this);
    }
}
