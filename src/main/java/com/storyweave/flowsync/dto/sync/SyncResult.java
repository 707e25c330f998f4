package com.storyweave.flowsync.dto.sync;

import com.storyweave.flowsync.model.script.Script;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of pushing graph-side edits into a copy of the script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    private Script script;
    private boolean modified;

    @Builder.Default
    private List<SyncError> errors = new ArrayList<>();
}
