package com.mediacache.infrastructure.filesystem;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Compensating actions for the filesystem steps of one relocation, undone in reverse order.
 *
 * <p>Each mutating step registers its undo right after it succeeds. Rollback runs every undo
 * even when an earlier one fails and reports the steps it could not undo.
 */
@Slf4j
public class RollbackJournal {

    @FunctionalInterface
    public interface UndoAction {
        void undo() throws IOException;
    }

    private static final class Entry {
        private final String description;
        private final UndoAction action;

        private Entry(String description, UndoAction action) {
            this.description = description;
            this.action = action;
        }
    }

    private final Deque<Entry> entries = new ArrayDeque<>();

    public void record(String description, UndoAction action) {
        entries.push(new Entry(description, action));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Forget every entry; called once the relocation is durable.
     */
    public void commit() {
        entries.clear();
    }

    /**
     * @return descriptions of the steps whose undo failed, empty when fully restored
     */
    public List<String> rollback() {
        List<String> failures = new ArrayList<>();
        while (!entries.isEmpty()) {
            Entry entry = entries.pop();
            try {
                entry.action.undo();
                log.debug("Rolled back: {}", entry.description);
            } catch (IOException | RuntimeException e) {
                log.error("Rollback step failed: {}: {}", entry.description, e.getMessage(), e);
                failures.add(entry.description);
            }
        }
        return failures;
    }
}
