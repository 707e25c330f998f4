package com.storyweave.flowsync.model.script;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Base of every statement in a script tree.
 *
 * The id is stable across edits. Line and raw carry the original source position and text,
 * which the serializer reuses for statements that were not edited.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LabelNode.class, name = "label"),
        @JsonSubTypes.Type(value = DialogueNode.class, name = "dialogue"),
        @JsonSubTypes.Type(value = MenuNode.class, name = "menu"),
        @JsonSubTypes.Type(value = IfNode.class, name = "if"),
        @JsonSubTypes.Type(value = JumpNode.class, name = "jump"),
        @JsonSubTypes.Type(value = CallNode.class, name = "call"),
        @JsonSubTypes.Type(value = ReturnNode.class, name = "return"),
        @JsonSubTypes.Type(value = SceneNode.class, name = "scene"),
        @JsonSubTypes.Type(value = ShowNode.class, name = "show"),
        @JsonSubTypes.Type(value = HideNode.class, name = "hide"),
        @JsonSubTypes.Type(value = WithNode.class, name = "with"),
        @JsonSubTypes.Type(value = SetNode.class, name = "set"),
        @JsonSubTypes.Type(value = PythonNode.class, name = "python"),
        @JsonSubTypes.Type(value = PauseNode.class, name = "pause"),
        @JsonSubTypes.Type(value = RawNode.class, name = "raw")
})
public abstract class ScriptNode {

    private String id;
    private Integer line;
    private String raw;

    @JsonIgnore
    public abstract StatementKind getKind();

    public abstract <R> R accept(ScriptNodeVisitor<R> visitor);
}
