package com.vncalign.orchestrator.executor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the last {@code capacity} lines written by a child process.
 * The executor can print for many minutes; only the end is useful when
 * reporting why it failed.
 */
public class OutputTail {

    private final int capacity;
    private final Deque<String> lines = new ArrayDeque<>();

    public OutputTail(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
    }

    public synchronized void append(String line) {
        if (lines.size() == capacity) {
            lines.removeFirst();
        }
        lines.addLast(line);
    }

    synchronized List<String> lines() {
        return List.copyOf(lines);
    }

    /** Non-blank lines joined with newlines; empty string if nothing was captured. */
    public synchronized String text() {
        return String.join("\n", lines.stream().filter(l -> !l.isBlank()).toList()).strip();
    }
}
