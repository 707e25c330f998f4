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
public class ConnectResult {

    private boolean success;
    private Script script;      // script after the connection; the input script when nothing changed
    private String astNodeId;   // statement created for a pending node, if any
    private SyncError error;
}
