package com.dealgrid.app.services;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Snapshot history with a present state and bounded past/future stacks.
 * The oldest entries are dropped when a stack exceeds the limit.
 *
 * @param <S> immutable snapshot type
 */
public class UndoRedoManager<S> {

    private final Deque<S> past = new ArrayDeque<>();
    private final Deque<S> future = new ArrayDeque<>();
    private final int limit;
    private S present;

    public UndoRedoManager(S initial, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be positive: " + limit);
        }
        this.present = initial;
        this.limit = limit;
    }

    /**
     * Records a new present state. The previous one becomes undoable and the redo
     * stack is cleared.
     */
    public void commit(S state) {
        push(past, present);
        future.clear();
        present = state;
    }

    /**
     * Steps back one state and returns it, or null when there is nothing to undo.
     */
    public S undo() {
        if (past.isEmpty()) {
            return null;
        }
        push(future, present);
        present = past.pop();
        return present;
    }

    /**
     * Steps forward one state and returns it, or null when there is nothing to redo.
     */
    public S redo() {
        if (future.isEmpty()) {
            return null;
        }
        push(past, present);
        present = future.pop();
        return present;
    }

    /**
     * Swaps the present state without touching either stack. Used when a change that is
     * not itself undoable alters what the present state has to cover.
     */
    public void replacePresent(S state) {
        present = state;
    }

    public void reset(S state) {
        past.clear();
        future.clear();
        present = state;
    }

    public boolean canUndo() {
        return !past.isEmpty();
    }

    public boolean canRedo() {
        return !future.isEmpty();
    }

    public S getPresent() {
        return present;
    }

    public int getUndoDepth() {
        return past.size();
    }

    public int getRedoDepth() {
        return future.size();
    }

    private void push(Deque<S> stack, S state) {
        stack.push(state);
        while (stack.size() > limit) {
            stack.removeLast();
        }
    }
}
