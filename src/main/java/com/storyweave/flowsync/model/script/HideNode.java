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
public class HideNode extends ScriptNode {

    private String image;

    @Override
    public StatementKind getKind() {
        return StatementKind.HIDE;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitHide(this);
    }
}
