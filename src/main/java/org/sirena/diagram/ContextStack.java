package org.sirena.diagram;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Scope stack threaded through a traversal: sections, namespaces, boundaries and
 * similar groupings push on entry and pop on exit.
 */
public class ContextStack<T> {

    private final Deque<T> frames = new ArrayDeque<>();

    public void push(T frame) {
        frames.push(frame);
    }

    public T pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Context stack underflow");
        }
        return frames.pop();
    }

    /** Innermost frame, if any. */
    public Optional<T> current() {
        return Optional.ofNullable(frames.peek());
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }

    /** Frames from outermost to innermost. */
    public List<T> path() {
        List<T> path = new ArrayList<>(frames);
        Collections.reverse(path);
        return path;
    }

    /** Pushes {@code frame}, runs {@code body}, and pops again even if the body throws. */
    public void within(T frame, Runnable body) {
        push(frame);
        try {
            body.run();
        } finally {
            pop();
        }
    }
}
