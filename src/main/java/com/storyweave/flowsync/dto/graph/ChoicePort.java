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
 * Menu choice exposed as a named output port.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ChoicePort {
    private String portId;
    private String text;
    private String condition;
    private String targetLabel;     // first jump target in the choice body, if any

    @Builder.Default
    private List<ScriptNode> body = new ArrayList<>();
}
