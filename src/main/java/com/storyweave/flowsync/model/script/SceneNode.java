package com.storyweave.flowsync.model.script;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Backdrop change. Always opens a new merged content block in the graph view.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SceneNode extends ScriptNode {

    private String image;
    private String layer;

    @Override
    public StatementKind getKind() {
        return StatementKind.SCENE;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitScene(this);
    }
}
