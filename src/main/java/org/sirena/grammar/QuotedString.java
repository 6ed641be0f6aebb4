package org.sirena.grammar;

/**
 * Quoted string literal with backslash escapes. The resulting leaf holds the unescaped
 * content without the surrounding quotes.
 */
final class QuotedString implements Rule {

    private final char quote;

    QuotedString(char quote) {
        this.quote = quote;
    }

    @Override
    public CstNode parse(ParseState state) {
        int start = state.pos();
        String input = state.input();
        if (state.atEnd() || state.peek() != quote) {
            state.expect(quote == '"' ? "double-quoted string" : "single-quoted string");
            return null;
        }
        StringBuilder content = new StringBuilder();
        int i = start + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\' && i + 1 < input.length()) {
                content.append(input.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == quote) {
                state.reset(i + 1);
                return new CstNode.Leaf(content.toString(), start, i + 1);
            }
            content.append(c);
            i++;
        }
        state.reset(i);
        state.expect("closing " + quote);
        state.reset(start);
        return null;
    }
}
