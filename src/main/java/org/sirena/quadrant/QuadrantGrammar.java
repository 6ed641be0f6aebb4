package org.sirena.quadrant;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code quadrantChart} documents.
 */
public class QuadrantGrammar extends Grammar {

    private static final Rule ARROW = str("-->");

    private final Rule header = seq(keyword("quadrantChart"), LINE_END);

    private final Rule xAxis = seq(
            keyword("x-axis"), SPACES, anyUntil(choice(seq(OPT_SPACES, ARROW), LINE_END)).as("x_left"),
            seq(OPT_SPACES, ARROW, OPT_SPACES, REST_OF_LINE.as("x_right")).maybe(),
            LINE_END);

    private final Rule yAxis = seq(
            keyword("y-axis"), SPACES, anyUntil(choice(seq(OPT_SPACES, ARROW), LINE_END)).as("y_bottom"),
            seq(OPT_SPACES, ARROW, OPT_SPACES, REST_OF_LINE.as("y_top")).maybe(),
            LINE_END);

    private final Rule quadrant = seq(
            str("quadrant-"), match("[1-4]").as("quadrant"), SPACES, REST_OF_LINE.as("quadrant_label"), LINE_END);

    private final Rule classDef = seq(
            keyword("classDef"), SPACES, IDENTIFIER.as("class_def"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final Rule pointStyle = choice(
            style("radius", NUMBER),
            style("stroke-color", match("[#a-zA-Z0-9]").repeat(1)),
            style("stroke-width", seq(NUMBER, str("px").maybe())),
            style("color", match("[#a-zA-Z0-9]").repeat(1)));

    private final Rule point = seq(
            choice(STRING, anyUntil(choice(COLON, NEWLINE))).as("point"),
            seq(str(":::"), IDENTIFIER.as("class_name")).maybe(),
            OPT_SPACES, COLON, OPT_SPACES, LBRACKET, OPT_SPACES,
            NUMBER.as("x"), OPT_SPACES, COMMA, OPT_SPACES, NUMBER.as("y"), OPT_SPACES, RBRACKET,
            seq(SPACES, pointStyle, seq(OPT_SPACES, COMMA, OPT_SPACES, pointStyle).repeat(0)).as("styles").maybe(),
            LINE_END);

    private final Rule root = document(header, choice(METADATA, xAxis, yAxis, quadrant, classDef, point));

    private static Rule style(String name, Rule value) {
        return seq(str(name), OPT_SPACES, COLON, OPT_SPACES, value.as(name));
    }

    @Override
    protected Rule root() {
        return root;
    }
}
