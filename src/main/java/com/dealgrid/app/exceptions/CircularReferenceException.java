package com.dealgrid.app.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown during recursive evaluation when a formula cell is re-entered
 * while it is still being evaluated (a cell referencing itself, or a multi-cell loop).
 * Carries the evaluation path so every cell on it can be marked.
 * Never leaves the recalculation layer.
 */
public class CircularReferenceException extends RuntimeException {

    private final List<String> path;

    public CircularReferenceException(String message, List<String> path) {
        super(message);
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    public List<String> getPath() {
        return path;
    }
}
