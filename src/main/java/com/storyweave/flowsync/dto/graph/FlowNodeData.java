package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Type-specific payload of a flow node. Fields that do not apply to a node type stay null,
 * which also lets a partial instance act as a patch (see {@link #merge(FlowNodeData)}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowNodeData {

    // Entry point
    private String label;
    private String preview;
    private ExitType exitType;
    private Boolean hasIncoming;

    // Merged content block
    private List<DialogueItem> dialogues;
    private List<VisualCommand> visualCommands;
    private Boolean expanded;

    // Menu
    private String prompt;
    private List<ChoicePort> choices;

    // Condition
    private String condition;
    private List<BranchPort> branches;

    // Jump / call
    private String target;
    private Boolean call;

    // Ids of the script statements this node stands for, in body order
    private List<String> astNodeIds;

    @JsonIgnore
    public List<String> constituentIds() {
        return astNodeIds != null ? astNodeIds : Collections.emptyList();
    }

    /**
     * Id of the last statement this node covers; new statements connected after the node go behind it.
     */
    @JsonIgnore
    public String lastConstituentId() {
        List<String> ids = constituentIds();
        return ids.isEmpty() ? null : ids.get(ids.size() - 1);
    }

    /**
     * Copy of this data with every non-null field of the patch applied on top.
     */
    public FlowNodeData merge(FlowNodeData patch) {
        FlowNodeData merged = copy();
        if (patch == null) return merged;
        if (patch.label != null) merged.label = patch.label;
        if (patch.preview != null) merged.preview = patch.preview;
        if (patch.exitType != null) merged.exitType = patch.exitType;
        if (patch.hasIncoming != null) merged.hasIncoming = patch.hasIncoming;
        if (patch.dialogues != null) merged.dialogues = new ArrayList<>(patch.dialogues);
        if (patch.visualCommands != null) merged.visualCommands = new ArrayList<>(patch.visualCommands);
        if (patch.expanded != null) merged.expanded = patch.expanded;
        if (patch.prompt != null) merged.prompt = patch.prompt;
        if (patch.choices != null) merged.choices = new ArrayList<>(patch.choices);
        if (patch.condition != null) merged.condition = patch.condition;
        if (patch.branches != null) merged.branches = new ArrayList<>(patch.branches);
        if (patch.target != null) merged.target = patch.target;
        if (patch.call != null) merged.call = patch.call;
        if (patch.astNodeIds != null) merged.astNodeIds = new ArrayList<>(patch.astNodeIds);
        return merged;
    }

    public FlowNodeData copy() {
        return FlowNodeData.builder()
                .label(label)
                .preview(preview)
                .exitType(exitType)
                .hasIncoming(hasIncoming)
                .dialogues(dialogues != null ? new ArrayList<>(dialogues) : null)
                .visualCommands(visualCommands != null ? new ArrayList<>(visualCommands) : null)
                .expanded(expanded)
                .prompt(prompt)
                .choices(choices != null ? new ArrayList<>(choices) : null)
                .condition(condition)
                .branches(branches != null ? new ArrayList<>(branches) : null)
                .target(target)
                .call(call)
                .astNodeIds(astNodeIds != null ? new ArrayList<>(astNodeIds) : null)
                .build();
    }
}
