package com.storyweave.flowsync.service.history;

import com.storyweave.flowsync.model.script.Script;

import java.time.LocalDateTime;

/**
 * One script snapshot in the undo/redo history.
 */
public record HistoryEntry(LocalDateTime timestamp, Script script) {
}
