package com.storyweave.flowsync.dto.sync;

import com.storyweave.flowsync.model.script.Script;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of committing the pending pool into the script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitResult {

    private boolean success;
    private Script script;

    @Builder.Default
    private List<String> syncedNodeIds = new ArrayList<>();

    @Builder.Default
    private List<String> orphanNodeIds = new ArrayList<>();

    @Builder.Default
    private List<SyncError> errors = new ArrayList<>();
}
