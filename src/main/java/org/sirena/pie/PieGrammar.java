package org.sirena.pie;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code pie} documents.
 */
public class PieGrammar extends Grammar {

    private final Rule header = seq(
            choice(keyword("pie"), keyword("Pie")),
            seq(SPACES, keyword("showData"), constant("show_data", "true")).maybe(),
            seq(SPACES, keyword("title"), SPACES, REST_OF_LINE.as("title")).maybe(),
            LINE_END);

    private final Rule slice = seq(
            STRING.as("label"), OPT_SPACES, COLON, OPT_SPACES, NUMBER.as("value"), LINE_END);

    private final Rule root = document(header, choice(METADATA, slice));

    @Override
    protected Rule root() {
        return root;
    }
}
