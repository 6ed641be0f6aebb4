package org.sirena.kanban;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code kanban} documents: indented {@code id[text]}, {@code [text]} or
 * plain-text lines, each optionally followed by a {@code @{ key: value, ... }} metadata block.
 */
public class KanbanGrammar extends Grammar {

    private static final Rule METADATA_OPEN = str("@{");

    private final Rule header = seq(keyword("kanban"), LINE_END);

    private final Rule pair = seq(
            IDENTIFIER.as("key"), OPT_SPACES, COLON, OPT_SPACES,
            choice(STRING, anyUntil(choice(COMMA, RBRACE, NEWLINE))).as("value"));

    private final Rule metadata = seq(
            OPT_SPACES, METADATA_OPEN, OPT_SPACES,
            seq(pair, seq(OPT_SPACES, COMMA, OPT_SPACES, pair).repeat(0)).as("metadata"),
            OPT_SPACES, RBRACE);

    private final Rule item = choice(
            seq(match("[a-zA-Z0-9_\\-]").repeat(1).as("id"),
                    LBRACKET, anyUntil(choice(RBRACKET, NEWLINE)).as("text"), RBRACKET),
            seq(LBRACKET, anyUntil(choice(RBRACKET, NEWLINE)).as("text"), RBRACKET, constant("anonymous", "true")),
            anyUntil(choice(seq(OPT_SPACES, METADATA_OPEN), LINE_END)).as("text"));

    private final Rule line = seq(OPT_SPACES.as("indent"), item, metadata.maybe(), LINE_END);

    private final Rule root = indentedDocument(header, line);

    @Override
    protected Rule root() {
        return root;
    }
}
