package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storyweave.flowsync.model.script.ScriptNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditional branch exposed as a named output port. A null condition is the else branch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BranchPort {
    private String portId;
    private String condition;
    private String targetLabel;

    @Builder.Default
    private List<ScriptNode> body = new ArrayList<>();
}
