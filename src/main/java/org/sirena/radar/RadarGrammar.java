package org.sirena.radar;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code radar-beta} documents.
 */
public class RadarGrammar extends Grammar {

    private final Rule header = seq(str("radar-beta"), LINE_END);

    private final Rule label = seq(OPT_SPACES, LBRACKET, OPT_SPACES, STRING.as("label"), OPT_SPACES, RBRACKET);

    private final Rule axisDef = seq(IDENTIFIER.as("id"), label.maybe());

    private final Rule axis = seq(
            keyword("axis"), SPACES,
            seq(axisDef, seq(OPT_SPACES, COMMA, OPT_SPACES, axisDef).repeat(0)).as("axes"),
            LINE_END);

    private final Rule entry = choice(
            seq(IDENTIFIER.as("axis"), OPT_SPACES, COLON, OPT_SPACES, NUMBER.as("value")),
            NUMBER.as("value"));

    private final Rule curveDef = seq(
            IDENTIFIER.as("id"), label.maybe(), OPT_SPACES, LBRACE, OPT_SPACES,
            seq(entry, seq(OPT_SPACES, COMMA, OPT_SPACES, entry).repeat(0)).as("values"),
            OPT_SPACES, RBRACE);

    private final Rule curve = seq(
            keyword("curve"), SPACES,
            seq(curveDef, seq(OPT_SPACES, COMMA, OPT_SPACES, curveDef).repeat(0)).as("curves"),
            LINE_END);

    private final Rule option = seq(
            choice(
                    seq(keyword("ticks"), constant("option", "ticks"), SPACES, INTEGER.as("option_value")),
                    seq(keyword("showLegend"), constant("option", "showLegend"), SPACES,
                            oneOf("true", "false").as("option_value")),
                    seq(keyword("graticule"), constant("option", "graticule"), SPACES,
                            oneOf("polygon", "circle").as("option_value")),
                    seq(keyword("min"), constant("option", "min"), SPACES, NUMBER.as("option_value")),
                    seq(keyword("max"), constant("option", "max"), SPACES, NUMBER.as("option_value"))),
            LINE_END);

    private final Rule root = document(header, choice(METADATA, axis, curve, option));

    @Override
    protected Rule root() {
        return root;
    }
}
