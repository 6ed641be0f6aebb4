package org.sirena.sankey;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code sankey-beta} documents: comma separated {@code source,target,value}
 * lines. Fields may be double quoted, with {@code ""} standing for one quote.
 */
public class SankeyGrammar extends Grammar {

    private static final Rule DQ = str("\"");

    private final Rule header = seq(str("sankey-beta"), LINE_END);

    private final Rule flow = seq(
            field("source"), COMMA, field("target"), COMMA, OPT_SPACES, NUMBER.as("value"), LINE_END);

    private final Rule node = seq(
            anyUntil(choice(LBRACKET, COMMA, NEWLINE)).as("node"),
            LBRACKET, anyUntil(choice(RBRACKET, NEWLINE)).as("node_label"), RBRACKET, LINE_END);

    private final Rule root = document(header, choice(flow, node, METADATA));

    private static Rule field(String name) {
        Rule quotedChar = choice(str("\"\""), seq(DQ.absent(), any()));
        return choice(
                seq(OPT_SPACES, DQ, quotedChar.repeat(0).as(name), DQ, OPT_SPACES),
                anyUntil(choice(COMMA, NEWLINE)).as(name));
    }

    @Override
    protected Rule root() {
        return root;
    }
}
