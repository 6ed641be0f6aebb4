package org.sirena.flowchart;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;
import org.sirena.grammar.RuleRef;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code flowchart} / {@code graph} documents.
 */
public class FlowchartGrammar extends Grammar {

    private static final Rule ID_CHAR = match("[a-zA-Z0-9_]");

    private static final Rule DIRECTION = seq(oneOf("TB", "TD", "BT", "LR", "RL"), ID_CHAR.absent());

    private final Rule header = seq(
            choice(keyword("flowchart"), keyword("graph")),
            seq(SPACES, DIRECTION.as("direction")).maybe(),
            LINE_END);

    private final Rule nodeId = choice(QUOTED, ID_CHAR.repeat(1)).named("node id");

    private final Rule shape = choice(
            shape("(((", ")))", "double_circle"),
            shape("([", "])", "stadium"),
            shape("[[", "]]", "subroutine"),
            shape("[(", ")]", "cylindrical"),
            shape("((", "))", "circle"),
            shape("{{", "}}", "hexagon"),
            shape("[/", "/]", "parallelogram"),
            shape("[\\", "\\]", "parallelogram_alt"),
            shape("[/", "\\]", "trapezoid"),
            shape("[\\", "/]", "trapezoid_alt"),
            shape(">", "]", "asymmetric"),
            shape("[", "]", "rect"),
            shape("(", ")", "rounded"),
            shape("{", "}", "rhombus"));

    private final Rule classShorthand = seq(str(":::"), IDENTIFIER.as("class_ref"));

    private final Rule nodeRef = seq(nodeId.as("id"), shape.maybe(), classShorthand.maybe());

    // Each spelling is tried before any of its prefixes.
    private final Rule arrow = choice(
            seq(str("="), str("=").repeat(1), str(">"), constant("arrow_type", "thick_arrow")),
            seq(str("="), str("=").repeat(2), constant("arrow_type", "thick_line")),
            seq(str("-"), str(".").repeat(1), str("-"), str(">"), constant("arrow_type", "dotted_arrow")),
            seq(str("-"), str(".").repeat(1), str("-"), constant("arrow_type", "dotted_line")),
            seq(str("-"), str("-").repeat(1), str("o"), ID_CHAR.absent(), constant("arrow_type", "circle_end")),
            seq(str("-"), str("-").repeat(1), str("x"), ID_CHAR.absent(), constant("arrow_type", "cross_end")),
            seq(str("-"), str("-").repeat(1), str(">"), constant("arrow_type", "arrow")),
            seq(str("-"), str("-").repeat(2), constant("arrow_type", "line")),
            seq(str("->"), constant("arrow_type", "arrow")));

    private final Rule pipeLabel = seq(PIPE, anyUntil0(choice(PIPE, NEWLINE)).as("label"), PIPE);

    // A-- text -->B, A-. text .->B, A== text ==>B
    private final Rule textLink = choice(
            seq(str("--"), str("-").absent(), SPACES,
                    anyUntil(choice(str("-->"), str("---"), NEWLINE)).as("label"),
                    choice(seq(str("-->"), constant("arrow_type", "arrow")),
                            seq(str("---"), constant("arrow_type", "line")))),
            seq(str("-."), SPACES,
                    anyUntil(choice(str(".-"), NEWLINE)).as("label"),
                    choice(seq(str(".->"), constant("arrow_type", "dotted_arrow")),
                            seq(str(".-"), constant("arrow_type", "dotted_line")))),
            seq(str("=="), SPACES,
                    anyUntil(choice(str("=="), NEWLINE)).as("label"),
                    choice(seq(str("==>"), constant("arrow_type", "thick_arrow")),
                            seq(str("==="), constant("arrow_type", "thick_line")))));

    private final Rule link = choice(
            seq(arrow, seq(OPT_SPACES, pipeLabel).maybe()),
            textLink);

    private final Rule nodeStatement = seq(
            nodeRef.as("first"),
            seq(OPT_SPACES, link.as("link"), OPT_SPACES, nodeRef.as("node")).repeat(0).as("links"),
            LINE_END);

    private final Rule idList = seq(nodeId, seq(OPT_SPACES, COMMA, OPT_SPACES, nodeId).repeat(0));

    private final Rule styleStatement = seq(
            keyword("style"), SPACES, nodeId.as("style"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final Rule linkStyleStatement = seq(
            keyword("linkStyle"), SPACES, anyUntil(SPACE).as("link_style"), SPACES,
            REST_OF_LINE.as("css"), LINE_END);

    private final Rule classDefStatement = seq(
            keyword("classDef"), SPACES, idList.as("class_def"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final Rule classStatement = seq(
            keyword("class"), SPACES, idList.as("class_targets"), SPACES, IDENTIFIER.as("class_name"), LINE_END);

    private final Rule clickStatement = seq(
            keyword("click"), SPACES, nodeId.as("click"), SPACES,
            choice(
                    seq(keyword("href"), SPACES, STRING.as("href")),
                    seq(keyword("call"), SPACES, REST_OF_LINE.as("callback")),
                    STRING.as("href"),
                    REST_OF_LINE.as("callback")),
            seq(SPACES, STRING.as("tooltip")).maybe(),
            seq(SPACES, REST_OF_LINE.as("target")).maybe(),
            LINE_END);

    private final Rule directionStatement = seq(
            keyword("direction"), SPACES, DIRECTION.as("subgraph_direction"), LINE_END);

    private final RuleRef statement = ref("flowchart statement");

    private final Rule subgraph = seq(
            keyword("subgraph"), SPACES,
            nodeId.as("subgraph"),
            choice(
                    seq(OPT_SPACES, LBRACKET, anyUntil(choice(RBRACKET, NEWLINE)).as("title"), RBRACKET),
                    seq(SPACES, REST_OF_LINE.as("title")),
                    OPT_SPACES),
            LINE_END,
            blockBody(statement, "body"),
            WS, keyword("end"), LINE_END);

    private final Rule root;

    public FlowchartGrammar() {
        statement.define(choice(
                subgraph,
                directionStatement,
                styleStatement,
                linkStyleStatement,
                classDefStatement,
                classStatement,
                clickStatement,
                METADATA,
                nodeStatement));
        root = document(header, statement);
    }

    private static Rule shape(String open, String close, String kind) {
        return seq(str(open),
                anyUntil(choice(str(close), NEWLINE)).as("label"),
                str(close),
                constant("shape", kind));
    }

    @Override
    protected Rule root() {
        return root;
    }
}
