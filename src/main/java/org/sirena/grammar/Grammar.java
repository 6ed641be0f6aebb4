package org.sirena.grammar;

import java.util.Map;

/**
 * Base class of the per-notation grammars. Subclasses build their rules once, in field
 * initializers or the constructor, and expose the entry point through {@link #root()}.
 * A grammar instance holds no parse state and can be shared between threads.
 */
public abstract class Grammar {

    protected abstract Rule root();

    /** Statements separated by blank lines and comments, captured as {@code statements}. */
    protected static Rule statements(Rule statement) {
        return Rules.seq(Lexical.WS, statement).repeat(0).as("statements");
    }

    /** Statements of a nested block; a line starting with {@code end} closes the block. */
    protected static Rule blockBody(Rule statement, String name) {
        return Rules.seq(Lexical.WS, Lexical.keyword("end").absent(), statement).repeat(0).as(name);
    }

    /** Header, statements, trailing blank lines, end of input. */
    protected static Rule document(Rule header, Rule statement) {
        return Rules.seq(Lexical.WS, header, statements(statement), Lexical.WS, Lexical.EOF);
    }

    /**
     * Document whose lines keep their leading whitespace, for notations that encode
     * hierarchy by indentation. Only blank and comment-only lines are skipped between
     * lines; {@code line} is expected to capture its own indent.
     */
    protected static Rule indentedDocument(Rule header, Rule line) {
        Rule skipped = Rules.choice(Lexical.BLANK_LINE, Lexical.COMMENT_LINE).repeat(0);
        return Rules.seq(Lexical.WS, header,
                Rules.seq(skipped, line).repeat(0).as("statements"),
                Lexical.WS, Lexical.EOF);
    }

    /**
     * Parses a whole document.
     *
     * @param text the diagram source
     * @return the top-level capture record
     * @throws GrammarException if the text does not match or input is left over
     */
    public CstNode.Captures parse(String text) {
        ParseState state = new ParseState(text);
        CstNode result = root().parse(state);
        if (result == null || !state.atEnd()) {
            throw state.error();
        }
        if (result instanceof CstNode.Captures captures) {
            return captures;
        }
        if (result instanceof CstNode.Sequence sequence) {
            return new CstNode.Captures(Map.of("items", sequence), 0, text.length());
        }
        return CstNode.Captures.empty(0);
    }
}
