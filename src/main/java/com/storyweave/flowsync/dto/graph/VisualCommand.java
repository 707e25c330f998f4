package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storyweave.flowsync.model.script.StatementKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A scene, show, hide or with statement folded into a merged content block.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VisualCommand {
    private String id;
    private StatementKind type;
    private String target;      // image name, or transition for "with"
    private List<String> attributes;
}
