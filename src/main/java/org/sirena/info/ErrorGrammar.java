package org.sirena.info;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code error [message]}.
 */
public class ErrorGrammar extends Grammar {

    private final Rule root = seq(
            WS, choice(keyword("error"), keyword("Error")),
            seq(SPACES, REST_OF_LINE.as("message")).maybe(),
            LINE_END, WS, EOF);

    @Override
    protected Rule root() {
        return root;
    }
}
