package org.sirena.block;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;
import org.sirena.grammar.RuleRef;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code block-beta} documents. A line holds one or more blocks separated
 * by spaces, a connection, or opens a compound {@code block ... end}.
 */
public class BlockGrammar extends Grammar {

    private static final Rule ID_CHAR = match("[a-zA-Z0-9_]");

    private final Rule header = seq(choice(str("block-beta"), keyword("block")), LINE_END);

    private final Rule blockId = ID_CHAR.repeat(1).named("block id");

    private final Rule width = seq(COLON, INTEGER.as("width"));

    private final Rule shape = choice(
            shape("(((", ")))", "doublecircle"),
            shape("((", "))", "circle"),
            shape("([", "])", "stadium"),
            shape("[(", ")]", "cylinder"),
            shape("[[", "]]", "subroutine"),
            shape("{{", "}}", "hexagon"),
            shape(">", "]", "odd"),
            shape("[", "]", "square"),
            shape("(", ")", "round"),
            shape("{", "}", "diamond"));

    private final Rule space = seq(keyword("space"), constant("kind", "space"), width.maybe());

    private final Rule arrowBlock = seq(
            blockId.as("id"), str("<["), anyUntil(str("]>")).as("label"), str("]>"),
            LPAREN, anyUntil(RPAREN).as("arrow_direction"), RPAREN,
            constant("kind", "block_arrow"), width.maybe());

    private final Rule node = seq(blockId.as("id"), shape.maybe(), width.maybe(), constant("kind", "block"));

    private final Rule item = choice(space, arrowBlock, node);

    private final Rule items = seq(
            seq(item, seq(SPACES, item).repeat(0)).as("items"), LINE_END);

    private final Rule ref = seq(blockId.as("id"), shape.maybe());

    private final Rule connection = seq(
            ref.as("from"), OPT_SPACES,
            choice(
                    seq(str("--"), SPACES, STRING.as("edge_label"), SPACES, str("-->"), constant("arrow_type", "arrow")),
                    seq(str("-->"), constant("arrow_type", "arrow")),
                    seq(str("---"), constant("arrow_type", "line"))),
            OPT_SPACES, ref.as("to"), LINE_END);

    private final Rule columns = seq(
            keyword("columns"), SPACES, choice(INTEGER, keyword("auto")).as("columns"), LINE_END);

    private final Rule style = seq(
            keyword("style"), SPACES, blockId.as("style"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final Rule classDef = seq(
            keyword("classDef"), SPACES, IDENTIFIER.as("class_def"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final Rule classStatement = seq(
            keyword("class"), SPACES, anyUntil(SPACE).as("class_targets"), SPACES,
            IDENTIFIER.as("class_name"), LINE_END);

    private final RuleRef statement = ref("block statement");

    private final Rule compound = seq(
            keyword("block"), constant("compound", "true"),
            seq(COLON, blockId.as("compound_id")).maybe(),
            width.maybe(),
            LINE_END,
            blockBody(statement, "body"),
            WS, keyword("end"), LINE_END);

    private final Rule root;

    public BlockGrammar() {
        statement.define(choice(
                METADATA,
                columns,
                style,
                classDef,
                classStatement,
                compound,
                connection,
                items));
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
