package com.storyweave.flowsync.model.script;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IfBranch {

    /**
     * Null for the else branch.
     */
    private String condition;

    @Builder.Default
    private List<ScriptNode> body = new ArrayList<>();
}
