package com.storyweave.flowsync.service.sync;

import com.storyweave.flowsync.model.script.ScriptNode;

import java.util.List;

/**
 * Place of a statement in a script: the owning statement (null for top level),
 * which of the owner's child bodies holds it, and its index in that body.
 */
public record NodeLocation(String ownerId, int bodyIndex, int index, List<ScriptNode> body) {

    public boolean isTopLevel() {
        return ownerId == null;
    }
}
