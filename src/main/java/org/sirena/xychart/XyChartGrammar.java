package org.sirena.xychart;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code xychart-beta} documents.
 */
public class XyChartGrammar extends Grammar {

    private final Rule header = seq(
            str("xychart-beta"),
            seq(SPACES, oneOf("horizontal", "vertical").as("orientation")).maybe(),
            LINE_END);

    private final Rule category = choice(STRING, anyUntil(choice(COMMA, RBRACKET, NEWLINE))).as("category");

    private final Rule categories = seq(
            LBRACKET, OPT_SPACES,
            seq(category, seq(OPT_SPACES, COMMA, OPT_SPACES, category).repeat(0)).as("categories"),
            OPT_SPACES, RBRACKET);

    private final Rule range = seq(NUMBER.as("min"), OPT_SPACES, str("-->"), OPT_SPACES, NUMBER.as("max"));

    private final Rule axisLabel = seq(choice(STRING, IDENTIFIER).as("axis_label"), OPT_SPACES);

    private final Rule axis = seq(
            choice(seq(keyword("x-axis"), constant("axis", "x")),
                    seq(keyword("y-axis"), constant("axis", "y"))),
            choice(
                    seq(SPACES, axisLabel.maybe(), choice(categories, range)),
                    seq(SPACES, axisLabel),
                    OPT_SPACES),
            LINE_END);

    private final Rule data = seq(
            LBRACKET, OPT_SPACES,
            seq(NUMBER.as("value"), seq(OPT_SPACES, COMMA, OPT_SPACES, NUMBER.as("value")).repeat(0)).as("data"),
            OPT_SPACES, RBRACKET);

    private final Rule series = seq(
            choice(keyword("line"), keyword("bar"), keyword("dataset")).as("series"),
            SPACES, seq(STRING.as("series_name"), OPT_SPACES).maybe(),
            data, LINE_END);

    private final Rule root = document(header, choice(METADATA, axis, series));

    @Override
    protected Rule root() {
        return root;
    }
}
