package com.storyweave.flowsync.service.history;

import com.storyweave.flowsync.model.script.Script;
import com.storyweave.flowsync.service.sync.ScriptCloner;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Bounded undo/redo history of script snapshots.
 *
 * Snapshots are cloned on the way in and on the way out, so callers can keep editing the scripts they
 * pass or receive. Pushing a new state discards everything that could have been redone.
 * The oldest undo entries are dropped beyond the capacity.
 */
@Slf4j
public class ScriptHistory {

    private final ScriptCloner cloner;
    private final Clock clock;
    private final int capacity;

    private final Deque<HistoryEntry> past = new ArrayDeque<>();
    private final Deque<HistoryEntry> future = new ArrayDeque<>();
    private Script current;

    public ScriptHistory(ScriptCloner cloner, Clock clock, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.cloner = cloner;
        this.clock = clock;
        this.capacity = capacity;
    }

    /**
     * Starts a fresh history at the given state.
     */
    public void initialize(Script initial) {
        current = cloner.cloneScript(initial);
        past.clear();
        future.clear();
    }

    public Optional<Script> getCurrent() {
        return Optional.ofNullable(current).map(cloner::cloneScript);
    }

    public void push(Script state) {
        if (current != null) {
            remember(current);
        }
        current = cloner.cloneScript(state);
        future.clear();
    }

    /**
     * Steps back one state.
     *
     * @return the restored state, or empty when there is nothing to undo
     */
    public Optional<Script> undo() {
        if (past.isEmpty() || current == null) {
            return Optional.empty();
        }
        future.addFirst(entry(current));
        current = past.removeLast().script();
        log.debug("Undo: {} undo and {} redo steps left", past.size(), future.size());
        return getCurrent();
    }

    public Optional<Script> redo() {
        if (future.isEmpty()) {
            return Optional.empty();
        }
        if (current != null) {
            remember(current);
        }
        current = future.removeFirst().script();
        log.debug("Redo: {} undo and {} redo steps left", past.size(), future.size());
        return getCurrent();
    }

    public boolean canUndo() {
        return !past.isEmpty();
    }

    public boolean canRedo() {
        return !future.isEmpty();
    }

    public int getUndoCount() {
        return past.size();
    }

    public int getRedoCount() {
        return future.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Drops undo and redo entries; the current state stays.
     */
    public void clear() {
        past.clear();
        future.clear();
    }

    private void remember(Script script) {
        past.addLast(entry(script));
        while (past.size() > capacity) {
            past.removeFirst();
        }
    }

    private HistoryEntry entry(Script script) {
        return new HistoryEntry(LocalDateTime.now(clock), script);
    }
}
