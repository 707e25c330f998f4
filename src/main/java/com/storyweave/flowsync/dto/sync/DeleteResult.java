package com.storyweave.flowsync.dto.sync;

import com.storyweave.flowsync.model.script.Script;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * New script after a node deletion, plus what went away so the view can confirm it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteResult {

    private Script script;

    @Builder.Default
    private List<String> removedEdgeIds = new ArrayList<>();

    @Builder.Default
    private List<String> removedStatementIds = new ArrayList<>();
}
