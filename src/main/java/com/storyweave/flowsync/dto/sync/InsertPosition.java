package com.storyweave.flowsync.dto.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a statement goes in the script.
 *
 * By default the statement goes into the body of {@code labelName}, right after {@code afterNodeId}
 * (or first when that is null). When {@code parentNodeId} is set the statement instead opens the body
 * of choice/branch {@code portIndex} of that menu or conditional statement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsertPosition {

    private String labelName;
    private String afterNodeId;     // script statement id, null = start of body
    private String beforeNodeId;    // existing graph successor of the source, null = end of flow
    private String parentNodeId;    // script id of a menu/conditional when inserting into a port
    private Integer portIndex;

    public boolean isPortInsertion() {
        return parentNodeId != null && portIndex != null;
    }
}
