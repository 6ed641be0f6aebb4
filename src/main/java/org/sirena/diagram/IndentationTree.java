package org.sirena.diagram;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Rebuilds a hierarchy from the leading-whitespace width of a flat list of lines.
 * <p>
 * Indents are first made relative to the least indented line of the whole document,
 * then turned into a candidate level ({@code rel / 2}, or {@code rel / 4} when the
 * relative indent is odd). A line's parent is the closest preceding line with a lower
 * level that is still open; deeper open lines are closed when a shallower one appears.
 * The resulting depth therefore does not depend on whether the document steps by two
 * or four spaces.
 */
public final class IndentationTree {

    private IndentationTree() {
    }

    /**
     * Shape of the rebuilt tree, index-aligned with the input lines.
     *
     * @param levels  depth of each line, roots at 0
     * @param parents index of each line's parent, or -1 for roots
     */
    public record Layout(List<Integer> levels, List<Integer> parents) {
        public Layout {
            levels = List.copyOf(levels);
            parents = List.copyOf(parents);
        }

        public int size() {
            return levels.size();
        }

        public int level(int index)  { return levels.get(index); }
        public int parent(int index) { return parents.get(index); }

        public List<Integer> children(int index) {
            List<Integer> result = new ArrayList<>();
            for (int i = 0; i < parents.size(); i++) {
                if (parents.get(i) == index) result.add(i);
            }
            return result;
        }
    }

    public static int minIndent(List<Integer> indents) {
        return indents.isEmpty() ? 0 : Collections.min(indents);
    }

    /** Candidate level of one line given the document minimum. */
    public static int candidateLevel(int indent, int minIndent) {
        int relative = indent - minIndent;
        if (relative <= 0) {
            return 0;
        }
        int level = relative / 2;
        if (relative % 2 != 0) {
            level = relative / 4;
        }
        return level;
    }

    public static Layout build(List<Integer> indents) {
        int min = minIndent(indents);
        List<Integer> levels = new ArrayList<>(indents.size());
        List<Integer> parents = new ArrayList<>(indents.size());
        // open lines as {index, candidate level}, innermost on top
        Deque<int[]> open = new ArrayDeque<>();
        for (int i = 0; i < indents.size(); i++) {
            int candidate = candidateLevel(indents.get(i), min);
            while (!open.isEmpty() && open.peek()[1] >= candidate) {
                open.pop();
            }
            parents.add(open.isEmpty() ? -1 : open.peek()[0]);
            levels.add(open.size());
            open.push(new int[]{i, candidate});
        }
        return new Layout(levels, parents);
    }

    /** Width of the leading run of spaces and tabs. */
    public static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
