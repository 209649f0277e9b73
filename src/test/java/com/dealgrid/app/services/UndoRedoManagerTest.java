package com.dealgrid.app.services;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UndoRedoManagerTest {

    @Test
    void testUndoAndRedoWalkTheHistory() {
        UndoRedoManager<String> history = new UndoRedoManager<>("v0", 10);
        history.commit("v1");
        history.commit("v2");

        assertEquals("v1", history.undo());
        assertEquals("v0", history.undo());
        assertNull(history.undo());
        assertEquals("v0", history.getPresent());

        assertEquals("v1", history.redo());
        assertEquals("v2", history.redo());
        assertNull(history.redo());
    }

    @Test
    void testCommitClearsTheRedoStack() {
        UndoRedoManager<String> history = new UndoRedoManager<>("v0", 10);
        history.commit("v1");
        history.undo();
        assertTrue(history.canRedo());

        history.commit("v1b");
        assertFalse(history.canRedo());
        assertEquals("v0", history.undo());
    }

    @Test
    void testHistoryIsBounded() {
        UndoRedoManager<Integer> history = new UndoRedoManager<>(0, 3);
        for (int i = 1; i <= 10; i++) {
            history.commit(i);
        }
        assertEquals(3, history.getUndoDepth());
        assertEquals(9, history.undo());
        assertEquals(8, history.undo());
        assertEquals(7, history.undo());
        assertNull(history.undo());
        assertEquals(7, history.getPresent());
        assertEquals(3, history.getRedoDepth());
    }

    @Test
    void testResetDropsBothStacks() {
        UndoRedoManager<String> history = new UndoRedoManager<>("v0", 10);
        history.commit("v1");
        history.commit("v2");
        history.undo();

        history.reset("fresh");
        assertFalse(history.canUndo());
        assertFalse(history.canRedo());
        assertEquals("fresh", history.getPresent());
    }

    @Test
    void testLimitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new UndoRedoManager<>("v0", 0));
    }

    @Test
    void testReplacePresentKeepsBothStacks() {
        UndoRedoManager<String> history = new UndoRedoManager<>("v0", 10);
        history.commit("v1");
        history.replacePresent("v1b");
        assertEquals(1, history.getUndoDepth());

        history.commit("v2");
        assertEquals("v1b", history.undo());
        assertEquals("v0", history.undo());
        assertEquals("v1b", history.redo());
    }
}
