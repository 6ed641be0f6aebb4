package org.sirena.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Single character matcher built from a bracket expression such as {@code [a-zA-Z_]} or
 * {@code [^"\n]}. Supports ranges, negation and backslash escapes.
 */
final class CharClass implements Rule {

    private final String source;
    private final boolean negated;
    private final List<char[]> ranges;

    CharClass(String expression) {
        if (expression.length() < 2 || expression.charAt(0) != '[' || expression.charAt(expression.length() - 1) != ']') {
            throw new IllegalArgumentException("Character class must be bracketed: " + expression);
        }
        this.source = expression;
        String body = expression.substring(1, expression.length() - 1);
        int i = 0;
        boolean neg = false;
        if (body.startsWith("^")) {
            neg = true;
            i = 1;
        }
        this.negated = neg;
        this.ranges = new ArrayList<>();
        while (i < body.length()) {
            char lo = body.charAt(i);
            if (lo == '\\' && i + 1 < body.length()) {
                lo = unescape(body.charAt(++i));
            }
            i++;
            char hi = lo;
            if (i + 1 < body.length() && body.charAt(i) == '-') {
                hi = body.charAt(i + 1);
                if (hi == '\\' && i + 2 < body.length()) {
                    hi = unescape(body.charAt(i + 2));
                    i++;
                }
                i += 2;
            }
            ranges.add(new char[]{lo, hi});
        }
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> c;
        };
    }

    boolean matches(char c) {
        boolean in = false;
        for (char[] range : ranges) {
            if (c >= range[0] && c <= range[1]) {
                in = true;
                break;
            }
        }
        return in != negated;
    }

    @Override
    public CstNode parse(ParseState state) {
        if (!state.atEnd() && matches(state.peek())) {
            int start = state.pos();
            state.advance(1);
            return new CstNode.Leaf(state.input().substring(start, start + 1), start, start + 1);
        }
        state.expect(source);
        return null;
    }
}
