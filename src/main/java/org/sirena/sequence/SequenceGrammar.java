package org.sirena.sequence;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;
import org.sirena.grammar.RuleRef;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code sequenceDiagram} documents.
 */
public class SequenceGrammar extends Grammar {

    private static final Rule ACTOR_ID = match("[a-zA-Z0-9_]").repeat(1).named("participant id");

    private final Rule header = seq(keyword("sequenceDiagram"), LINE_END);

    private final Rule participant = seq(
            seq(keyword("create"), SPACES, constant("created", "true")).maybe(),
            choice(seq(keyword("participant"), constant("kind", "participant")),
                    seq(keyword("actor"), constant("kind", "actor"))),
            SPACES, ACTOR_ID.as("participant"),
            seq(SPACES, keyword("as"), SPACES, choice(QUOTED, REST_OF_LINE).as("alias")).maybe(),
            LINE_END);

    private final Rule destroy = seq(keyword("destroy"), SPACES, ACTOR_ID.as("destroy"), LINE_END);

    private final Rule autonumber = seq(
            keyword("autonumber"), OPT_SPACES, anyUntil0(LINE_END).as("autonumber"), LINE_END);

    private final Rule activate = seq(keyword("activate"), SPACES, ACTOR_ID.as("activate"), LINE_END);

    private final Rule deactivate = seq(keyword("deactivate"), SPACES, ACTOR_ID.as("deactivate"), LINE_END);

    private final Rule notePosition = choice(
            seq(keyword("left"), SPACES, keyword("of"), constant("position", "left_of")),
            seq(keyword("right"), SPACES, keyword("of"), constant("position", "right_of")),
            seq(keyword("over"), constant("position", "over")));

    private final Rule note = seq(
            choice(keyword("note"), keyword("Note")), SPACES, notePosition, SPACES,
            seq(ACTOR_ID, seq(OPT_SPACES, COMMA, OPT_SPACES, ACTOR_ID).repeat(0)).as("note_participants"),
            OPT_SPACES, COLON, OPT_SPACES, anyUntil0(LINE_END).as("note"), LINE_END);

    // Activation-suffixed spellings first, then each arrow before its own prefixes.
    private final Rule arrow = choice(
            arrow("-->>+", "dotted", "activate"),
            arrow("->>+", "solid", "activate"),
            arrow("-->>-", "dotted", "deactivate"),
            arrow("->>-", "solid", "deactivate"),
            arrow("-->>", "dotted", null),
            arrow("->>", "solid", null),
            arrow("--x", "dotted_cross", null),
            arrow("-x", "solid_cross", null),
            arrow("--)", "async_dotted", null),
            arrow("-)", "async", null),
            arrow("-->", "dotted_open", null),
            arrow("->", "solid_open", null));

    private final Rule message = seq(
            ACTOR_ID.as("from"), OPT_SPACES, arrow, OPT_SPACES, ACTOR_ID.as("to"),
            seq(OPT_SPACES, COLON, OPT_SPACES, anyUntil0(LINE_END).as("text")).maybe(),
            LINE_END);

    private final RuleRef statement = ref("sequence statement");

    private final Rule box = seq(
            keyword("box"),
            choice(seq(SPACES, REST_OF_LINE.as("box")), constant("box", "")),
            LINE_END,
            blockBody(statement, "body"),
            WS, keyword("end"), LINE_END);

    private final Rule control = choice(
            control("loop", null),
            control("alt", "else"),
            control("opt", null),
            control("par", "and"),
            control("critical", "option"),
            control("break", null),
            control("rect", null));

    private final Rule root;

    public SequenceGrammar() {
        statement.define(choice(
                participant,
                destroy,
                autonumber,
                activate,
                deactivate,
                note,
                box,
                control,
                METADATA,
                message));
        root = document(header, statement);
    }

    private static Rule arrow(String spelling, String kind, String activation) {
        Rule plain = seq(str(spelling), constant("arrow_type", kind));
        return activation == null ? plain : seq(plain, constant("activation", activation));
    }

    private Rule control(String keyword, String branchKeyword) {
        Rule opening = seq(
                keyword(keyword), constant("block", keyword),
                OPT_SPACES, anyUntil0(LINE_END).as("label"), LINE_END,
                blockBody(statement, "body"));
        Rule closing = seq(WS, keyword("end"), LINE_END);
        if (branchKeyword == null) {
            return seq(opening, closing);
        }
        Rule branch = seq(
                WS, keyword(branchKeyword),
                OPT_SPACES, anyUntil0(LINE_END).as("label"), LINE_END,
                blockBody(statement, "body"));
        return seq(opening, branch.repeat(0).as("branches"), closing);
    }

    @Override
    protected Rule root() {
        return root;
    }
}
