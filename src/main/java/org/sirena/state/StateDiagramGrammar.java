package org.sirena.state;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;
import org.sirena.grammar.RuleRef;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code stateDiagram} and {@code stateDiagram-v2} documents.
 */
public class StateDiagramGrammar extends Grammar {

    private static final Rule STATE_ID = match("[a-zA-Z0-9_]").repeat(1).named("state id");

    private static final Rule STATE_REF = choice(str("[*]"), STATE_ID);

    private final Rule header = seq(str("stateDiagram"), str("-v2").maybe(), match("[a-zA-Z0-9_]").absent(),
            LINE_END);

    private final Rule direction = seq(
            keyword("direction"), SPACES, oneOf("TB", "TD", "BT", "LR", "RL").as("direction"), LINE_END);

    private final RuleRef statement = ref("state statement");

    private final Rule marker = seq(
            OPT_SPACES, str("<<"), oneOf("choice", "fork", "join").as("marker"), str(">>"));

    private final Rule composite = seq(
            OPT_SPACES, LBRACE,
            seq(WS, RBRACE.absent(), statement).repeat(0).as("body"),
            WS, RBRACE, constant("composite", "true"));

    private final Rule stateDeclaration = seq(
            keyword("state"), SPACES,
            choice(
                    seq(QUOTED.as("state_label"), SPACES, keyword("as"), SPACES, STATE_ID.as("state")),
                    STATE_ID.as("state")),
            choice(
                    marker,
                    composite,
                    seq(OPT_SPACES, COLON, OPT_SPACES, REST_OF_LINE.as("description"))).maybe(),
            LINE_END);

    private final Rule separator = seq(str("--"), constant("separator", "true"), LINE_END);

    private final Rule transition = seq(
            STATE_REF.as("from"), OPT_SPACES, str("-->"), OPT_SPACES, STATE_REF.as("to"),
            seq(OPT_SPACES, str("-->"), OPT_SPACES, STATE_REF.as("next")).repeat(0).as("chain"),
            seq(OPT_SPACES, COLON, OPT_SPACES, REST_OF_LINE.as("label")).maybe(),
            LINE_END);

    private final Rule notePosition = choice(
            seq(keyword("left"), SPACES, keyword("of"), constant("position", "left_of")),
            seq(keyword("right"), SPACES, keyword("of"), constant("position", "right_of")));

    private static final Rule END_NOTE = seq(OPT_SPACES, keyword("end"), SPACES, keyword("note"));

    private final Rule note = seq(
            keyword("note"), SPACES, notePosition, SPACES, STATE_ID.as("note_of"),
            choice(
                    seq(OPT_SPACES, COLON, OPT_SPACES, REST_OF_LINE.as("note"), LINE_END),
                    seq(LINE_END, anyUntil(seq(NEWLINE, END_NOTE)).as("note"), NEWLINE, END_NOTE, LINE_END)));

    private final Rule description = seq(
            STATE_ID.as("described"), OPT_SPACES, COLON, OPT_SPACES, REST_OF_LINE.as("description"), LINE_END);

    private final Rule classDef = seq(
            keyword("classDef"), SPACES, IDENTIFIER.as("class_def"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final Rule classStatement = seq(
            keyword("class"), SPACES,
            seq(STATE_ID, seq(OPT_SPACES, COMMA, OPT_SPACES, STATE_ID).repeat(0)).as("class_targets"),
            SPACES, IDENTIFIER.as("class_name"), LINE_END);

    private final Rule root;

    public StateDiagramGrammar() {
        statement.define(choice(
                direction,
                stateDeclaration,
                separator,
                note,
                classDef,
                classStatement,
                METADATA,
                transition,
                description,
                seq(STATE_ID.as("state"), LINE_END)));
        root = document(header, statement);
    }

    @Override
    protected Rule root() {
        return root;
    }
}
