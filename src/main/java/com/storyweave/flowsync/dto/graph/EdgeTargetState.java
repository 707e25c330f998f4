package com.storyweave.flowsync.dto.graph;

/**
 * How the target end of an edge is known.
 */
public enum EdgeTargetState {
    /** Target is a node id present in the graph. */
    RESOLVED,
    /** Target names an entry point that does not exist yet; only the label name is known. */
    UNRESOLVED,
    /** No target at all. */
    ABSENT
}
