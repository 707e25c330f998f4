package com.storyweave.flowsync.model.script;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root of a parsed script: the authoritative tree the graph view is derived from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Script {

    @Builder.Default
    private List<ScriptNode> statements = new ArrayList<>();

    private ScriptMetadata metadata;

    /**
     * Top-level entry point with the given name, if declared.
     */
    public Optional<LabelNode> findLabel(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return statements.stream()
                .filter(LabelNode.class::isInstance)
                .map(LabelNode.class::cast)
                .filter(label -> name.equals(label.getName()))
                .findFirst();
    }

    @JsonIgnore
    public List<LabelNode> getLabels() {
        return statements.stream()
                .filter(LabelNode.class::isInstance)
                .map(LabelNode.class::cast)
                .toList();
    }
}
