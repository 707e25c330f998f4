package com.storyweave.flowsync.dto.sync;

import com.storyweave.flowsync.model.script.Script;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationResult {

    private boolean success;
    private Script script;
    private SyncError error;

    public static OperationResult ok(Script script) {
        return OperationResult.builder().success(true).script(script).build();
    }

    public static OperationResult failed(Script script, SyncError error) {
        return OperationResult.builder().success(false).script(script).error(error).build();
    }
}
