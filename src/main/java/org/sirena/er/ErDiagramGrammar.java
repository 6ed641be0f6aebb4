package org.sirena.er;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code erDiagram} documents. Cardinality markers are read as any pair of
 * {@code | o { }} characters; the transform decides which pairs are meaningful.
 */
public class ErDiagramGrammar extends Grammar {

    private static final Rule ENTITY_NAME = choice(
            QUOTED,
            seq(match("[a-zA-Z_]"), match("[a-zA-Z0-9_\\-]").repeat(0))).named("entity name");

    private static final Rule CARDINALITY = seq(match("[|o{}]"), match("[|o{}]")).named("cardinality");

    private final Rule header = seq(keyword("erDiagram"), LINE_END);

    private final Rule alias = seq(
            LBRACKET, choice(QUOTED, anyUntil(choice(RBRACKET, NEWLINE))).as("alias"), RBRACKET);

    private final Rule keys = seq(
            oneOf("PK", "FK", "UK"),
            seq(OPT_SPACES, COMMA, OPT_SPACES, oneOf("PK", "FK", "UK")).repeat(0));

    private final Rule attribute = seq(
            seq(match("[a-zA-Z_]"), match("[a-zA-Z0-9_()\\[\\]\\-]").repeat(0)).as("type"),
            SPACES,
            seq(match("[a-zA-Z_*]"), match("[a-zA-Z0-9_\\-]").repeat(0)).as("name"),
            seq(SPACES, keys.as("keys")).maybe(),
            seq(SPACES, QUOTED.as("comment")).maybe(),
            OPT_SPACES);

    private final Rule entity = seq(
            ENTITY_NAME.as("entity"), alias.maybe(),
            seq(OPT_SPACES, LBRACE,
                    seq(WS, RBRACE.absent(), OPT_SPACES, attribute).repeat(0).as("attributes"),
                    WS, RBRACE).maybe(),
            LINE_END);

    private final Rule relationship = seq(
            ENTITY_NAME.as("from"), OPT_SPACES,
            CARDINALITY.as("card_from"), oneOf("--", "..", "==").as("operator"), CARDINALITY.as("card_to"),
            OPT_SPACES, ENTITY_NAME.as("to"),
            seq(OPT_SPACES, COLON, OPT_SPACES, choice(QUOTED, REST_OF_LINE).as("label")).maybe(),
            LINE_END);

    private final Rule root = document(header, choice(METADATA, relationship, entity));

    @Override
    protected Rule root() {
        return root;
    }
}
