package com.storyweave.flowsync.dto.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddLabelResult {

    private boolean success;
    private String labelId;     // id of the created entry point, on success
    private SyncError error;

    public static AddLabelResult added(String labelId) {
        return AddLabelResult.builder().success(true).labelId(labelId).build();
    }

    public static AddLabelResult failed(SyncError error) {
        return AddLabelResult.builder().success(false).error(error).build();
    }
}
