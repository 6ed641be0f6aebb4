package org.sirena.info;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code info [showInfo]}.
 */
public class InfoGrammar extends Grammar {

    private final Rule header = seq(
            keyword("info"),
            seq(SPACES, keyword("showInfo"), constant("show_info", "true")).maybe(),
            LINE_END);

    private final Rule root = document(header, METADATA);

    @Override
    protected Rule root() {
        return root;
    }
}
