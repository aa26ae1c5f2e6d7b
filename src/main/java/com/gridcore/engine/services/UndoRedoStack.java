package com.gridcore.engine.services;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded undo history. Pushing a new unit clears the redo side; when the
 * history is full the oldest unit is dropped.
 */
public class UndoRedoStack {

    private final Deque<UndoUnit> undoStack = new ArrayDeque<>();
    private final Deque<UndoUnit> redoStack = new ArrayDeque<>();
    private final int maxDepth;

    public UndoRedoStack(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    public void push(UndoUnit unit) {
        undoStack.push(unit);
        redoStack.clear();
        while (undoStack.size() > maxDepth) {
            undoStack.removeLast();
        }
    }

    /**
     * Moves the newest unit to the redo side and returns it, or null when empty.
     */
    public UndoUnit undo() {
        UndoUnit unit = undoStack.poll();
        if (unit != null) {
            redoStack.push(unit);
        }
        return unit;
    }

    /**
     * Moves the newest undone unit back to the undo side and returns it, or null when empty.
     */
    public UndoUnit redo() {
        UndoUnit unit = redoStack.poll();
        if (unit != null) {
            undoStack.push(unit);
        }
        return unit;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoSize() {
        return undoStack.size();
    }

    public int redoSize() {
        return redoStack.size();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }
}
