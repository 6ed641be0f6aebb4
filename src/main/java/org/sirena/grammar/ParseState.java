package org.sirena.grammar;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Cursor over one input buffer plus the furthest-failure bookkeeping used for error
 * reports. A new state is created for every parse; rules themselves hold no state.
 */
public final class ParseState {

    private final String input;
    private int pos;
    private int furthest = -1;
    private final Set<String> expected = new LinkedHashSet<>();
    private int silent;

    public ParseState(String input) {
        this.input = input;
    }

    public String input()    { return input; }
    public int pos()         { return pos; }
    public boolean atEnd()   { return pos >= input.length(); }

    public void reset(int to) {
        pos = to;
    }

    public void advance(int count) {
        pos += count;
    }

    public char peek() {
        return input.charAt(pos);
    }

    public boolean lookingAt(String literal) {
        return input.startsWith(literal, pos);
    }

    /** Records that {@code what} was expected at the current position. */
    public void expect(String what) {
        if (silent > 0) return;
        if (pos > furthest) {
            furthest = pos;
            expected.clear();
        }
        if (pos == furthest) {
            expected.add(what);
        }
    }

    void enterSilent() { silent++; }
    void leaveSilent() { silent--; }

    public GrammarException error() {
        int offset = Math.max(furthest, 0);
        Set<String> exp = expected;
        if (furthest < pos) {
            offset = pos;
            exp = Set.of("end of input");
        }
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset && i < input.length(); i++) {
            if (input.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = input.indexOf('\n', lineStart);
        String sourceLine = input.substring(lineStart, lineEnd < 0 ? input.length() : lineEnd).replace("\r", "");
        return new GrammarException(offset, line, offset - lineStart + 1, exp, sourceLine);
    }
}
