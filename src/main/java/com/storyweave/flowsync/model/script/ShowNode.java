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
public class ShowNode extends ScriptNode {

    private String image;

    @Builder.Default
    private List<String> attributes = new ArrayList<>();

    private String atPosition;

    @Override
    public StatementKind getKind() {
        return StatementKind.SHOW;
    }

    @Override
    public <R> R accept(ScriptNodeVisitor<R> visitor) {
        return visitor.visitShow(this);
    }
}
