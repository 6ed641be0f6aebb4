package org.sirena.grammar;

import static org.sirena.grammar.Rules.*;

/**
 * Token-level rules shared by every notation: whitespace, line ends, comments,
 * identifiers, numbers, quoted strings, punctuation and the accessibility statements.
 * All rules here are immutable and safe to reuse from any grammar.
 */
public final class Lexical {

    private Lexical() {
    }

    public static final Rule SPACE = match("[ \t]").named("space");
    public static final Rule SPACES = SPACE.repeat(1);
    public static final Rule OPT_SPACES = SPACE.repeat(0);

    public static final Rule NEWLINE = choice(str("\r\n"), str("\n")).named("newline");
    public static final Rule EOF = eof();

    /** {@code %%} up to, not including, the newline. */
    public static final Rule COMMENT = seq(str("%%"), anyUntil0(NEWLINE));

    /** Optional {@code ;}, trailing spaces, optional comment, then a newline or end of input. */
    public static final Rule LINE_END = seq(
            str(";").maybe(),
            OPT_SPACES,
            choice(seq(COMMENT.maybe(), NEWLINE), EOF));

    /** Any run of spaces, newlines and comments. */
    public static final Rule WS = choice(SPACE, NEWLINE, COMMENT).repeat(0);

    public static final Rule IDENTIFIER = seq(match("[a-zA-Z_]"), match("[a-zA-Z0-9_]").repeat(0))
            .named("identifier");
    public static final Rule INTEGER = match("[0-9]").repeat(1).named("integer");
    public static final Rule DECIMAL = seq(INTEGER, str("."), INTEGER);
    /** Optionally signed integer or decimal. */
    public static final Rule NUMBER = seq(str("-").maybe(), INTEGER, seq(str("."), INTEGER).maybe())
            .named("number");

    public static final Rule QUOTED = new QuotedString('"');
    public static final Rule SINGLE_QUOTED = new QuotedString('\'');
    public static final Rule STRING = choice(QUOTED, SINGLE_QUOTED);

    public static final Rule COLON = str(":");
    public static final Rule SEMICOLON = str(";");
    public static final Rule COMMA = str(",");
    public static final Rule LPAREN = str("(");
    public static final Rule RPAREN = str(")");
    public static final Rule LBRACKET = str("[");
    public static final Rule RBRACKET = str("]");
    public static final Rule LBRACE = str("{");
    public static final Rule RBRACE = str("}");
    public static final Rule LANGLE = str("<");
    public static final Rule RANGLE = str(">");
    public static final Rule PIPE = str("|");
    public static final Rule EQUALS = str("=");
    public static final Rule PLUS = str("+");
    public static final Rule MINUS = str("-");
    public static final Rule STAR = str("*");
    public static final Rule TILDE = str("~");
    public static final Rule HASH = str("#");

    /** Rest of the current line, at least one character, stopping before {@link #LINE_END}. */
    public static final Rule REST_OF_LINE = anyUntil(LINE_END);

    /** Keyword followed by something other than an identifier character. */
    public static Rule keyword(String word) {
        return seq(str(word), match("[a-zA-Z0-9_]").absent());
    }

    public static final Rule TITLE = seq(
            keyword("title"), SPACES, REST_OF_LINE.as("title"), LINE_END);

    public static final Rule ACC_TITLE = seq(
            str("accTitle"), OPT_SPACES, COLON, OPT_SPACES,
            anyUntil0(LINE_END).as("acc_title"), LINE_END);

    public static final Rule ACC_DESCR = choice(
            seq(str("accDescr"), OPT_SPACES, COLON, OPT_SPACES,
                    anyUntil0(LINE_END).as("acc_descr"), LINE_END),
            seq(str("accDescr"), OPT_SPACES, LBRACE, WS,
                    anyUntil0(RBRACE).as("acc_descr"), RBRACE, LINE_END));

    /** {@link #TITLE}, {@link #ACC_TITLE} or {@link #ACC_DESCR}. */
    public static final Rule METADATA = choice(ACC_TITLE, ACC_DESCR, TITLE);

    /** A line holding only a comment. */
    public static final Rule COMMENT_LINE = seq(OPT_SPACES, COMMENT, choice(NEWLINE, EOF));

    /** A line holding nothing but spaces. */
    public static final Rule BLANK_LINE = seq(OPT_SPACES, NEWLINE);
}
