package com.storyweave.flowsync.model.script;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Source text the parser could not classify. Kept verbatim.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RawNode extends ScriptNode {

    private String content;

    @Override
    public StatementKind getKind() {
        return StatementKind.RAW;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitRaw(this);
    }
}
