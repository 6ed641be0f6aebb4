package org.sirena.journey;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code journey} documents.
 */
public class JourneyGrammar extends Grammar {

    private final Rule header = seq(keyword("journey"), LINE_END);

    private final Rule section = seq(keyword("section"), SPACES, REST_OF_LINE.as("section"), LINE_END);

    private final Rule task = seq(
            anyUntil(choice(COLON, NEWLINE)).as("task"), COLON, OPT_SPACES,
            seq(str("-").maybe(), INTEGER).as("score"), OPT_SPACES,
            seq(COLON, OPT_SPACES, anyUntil0(LINE_END).as("actors")).maybe(),
            LINE_END);

    private final Rule root = document(header, choice(METADATA, section, task));

    @Override
    protected Rule root() {
        return root;
    }
}
