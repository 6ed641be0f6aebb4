package org.sirena.treemap;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code treemap} and {@code treemap-beta} documents.
 */
public class TreemapGrammar extends Grammar {

    private final Rule header = seq(str("treemap"), str("-beta").maybe(), match("[a-zA-Z0-9_]").absent(), LINE_END);

    private final Rule classDef = seq(
            keyword("classDef"), SPACES, IDENTIFIER.as("class_def"), SPACES,
            anyUntil(choice(seq(SEMICOLON, OPT_SPACES, NEWLINE), LINE_END)).as("css"), LINE_END);

    private final Rule node = seq(
            OPT_SPACES.as("indent"), STRING.as("label"),
            seq(OPT_SPACES, choice(COLON, COMMA), OPT_SPACES, NUMBER.as("value")).maybe(),
            seq(OPT_SPACES, str(":::"), IDENTIFIER.as("class_name")).maybe(),
            LINE_END);

    private final Rule line = choice(
            seq(OPT_SPACES, METADATA),
            seq(OPT_SPACES, classDef),
            node);

    private final Rule root = indentedDocument(header, line);

    @Override
    protected Rule root() {
        return root;
    }
}
