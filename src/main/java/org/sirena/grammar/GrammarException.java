package org.sirena.grammar;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Raised when no grammar alternative matches. Position and expectations refer to the
 * furthest offset any terminal reached before the parse gave up.
 */
public class GrammarException extends DiagramParseException {

    private final int offset;
    private final int line;
    private final int column;
    private final List<String> expected;
    private final String sourceLine;

    public GrammarException(int offset, int line, int column, Set<String> expected, String sourceLine) {
        super(formatMessage(line, column, expected, sourceLine));
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.expected = List.copyOf(new TreeSet<>(expected));
        this.sourceLine = sourceLine;
    }

    private static String formatMessage(int line, int column, Set<String> expected, String sourceLine) {
        StringBuilder sb = new StringBuilder()
                .append("Parse error at line ").append(line)
                .append(", column ").append(column).append(": ");
        if (expected.isEmpty()) {
            sb.append("unexpected input");
        } else {
            sb.append("expected one of ").append(new TreeSet<>(expected));
        }
        sb.append('\n').append(sourceLine).append('\n');
        sb.append(" ".repeat(Math.max(0, column - 1))).append('^');
        return sb.toString();
    }

    @Override
    public Kind kind() {
        return Kind.GRAMMAR;
    }

    public int getOffset()          { return offset; }
    public int getLine()            { return line; }
    public int getColumn()          { return column; }
    public List<String> getExpected() { return expected; }
    public String getSourceLine()   { return sourceLine; }
}
