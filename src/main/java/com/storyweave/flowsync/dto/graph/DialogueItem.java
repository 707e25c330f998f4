package com.storyweave.flowsync.dto.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One dialogue line inside a merged content block.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DialogueItem {
    private String id;          // id of the dialogue statement in the script tree
    private String speaker;     // null for narration
    private String text;
    private List<String> attributes;
}
