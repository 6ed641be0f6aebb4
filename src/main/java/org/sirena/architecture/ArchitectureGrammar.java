package org.sirena.architecture;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code architecture-beta} documents.
 */
public class ArchitectureGrammar extends Grammar {

    private final Rule header = seq(str("architecture-beta"), LINE_END);

    private final Rule id = match("[a-zA-Z0-9_]").repeat(1).named("id");

    private final Rule icon = seq(LPAREN, anyUntil(choice(RPAREN, NEWLINE)).as("icon"), RPAREN);

    private final Rule label = seq(LBRACKET, anyUntil(choice(RBRACKET, NEWLINE)).as("label"), RBRACKET);

    private final Rule in = seq(SPACES, keyword("in"), SPACES, id.as("in"));

    private final Rule group = seq(
            keyword("group"), SPACES, id.as("group"), icon.maybe(), OPT_SPACES, label.maybe(), in.maybe(),
            LINE_END);

    private final Rule service = seq(
            keyword("service"), SPACES, id.as("service"), icon.maybe(), OPT_SPACES, label.maybe(), in.maybe(),
            LINE_END);

    private final Rule junction = seq(
            keyword("junction"), SPACES, id.as("junction"), in.maybe(), LINE_END);

    private final Rule side = oneOf("L", "R", "T", "B");

    private final Rule arrow = choice(
            seq(str("<-->"), constant("arrow_type", "both")),
            seq(str("<--"), constant("arrow_type", "backward")),
            seq(str("-->"), constant("arrow_type", "forward")),
            seq(str("--"), constant("arrow_type", "none")));

    private final Rule edge = seq(
            id.as("from"), seq(str("{group}")).maybe(), seq(COLON, side.as("from_side")).maybe(),
            OPT_SPACES, arrow, OPT_SPACES,
            seq(side.as("to_side"), COLON).maybe(), id.as("to"), seq(str("{group}")).maybe(),
            seq(OPT_SPACES, COLON, OPT_SPACES, REST_OF_LINE.as("edge_label")).maybe(),
            LINE_END);

    private final Rule root = document(header, choice(METADATA, group, service, junction, edge));

    @Override
    protected Rule root() {
        return root;
    }
}
