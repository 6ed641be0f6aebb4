package org.sirena.classdiagram;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;
import org.sirena.grammar.RuleRef;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code classDiagram} documents.
 */
public class ClassDiagramGrammar extends Grammar {

    private static final Rule WORD = match("[a-zA-Z0-9_]").repeat(1);

    /** {@code Name}, {@code pkg.Name} or a backtick-quoted name. */
    private static final Rule CLASS_NAME = choice(
            seq(str("`"), anyUntil(str("`")), str("`")),
            seq(WORD, seq(str("."), WORD).repeat(0))).named("class name");

    private final Rule header = seq(str("classDiagram"), str("-v2").maybe(), match("[a-zA-Z0-9_]").absent(),
            LINE_END);

    private final Rule direction = seq(
            keyword("direction"), SPACES, oneOf("TB", "TD", "BT", "LR", "RL").as("direction"), LINE_END);

    private final Rule generic = seq(TILDE, anyUntil(TILDE).as("generic"), TILDE);

    private final Rule stereotype = seq(str("<<"), anyUntil(str(">>")).as("stereotype"), str(">>"));

    private static final Rule MEMBER_STOP = choice(NEWLINE, RBRACE, EOF);

    private final Rule method = seq(
            anyUntil(choice(LPAREN, MEMBER_STOP)).as("method"),
            LPAREN, anyUntil0(choice(RPAREN, NEWLINE)).as("params"), RPAREN,
            match("[$*]").as("classifier").maybe(),
            seq(OPT_SPACES, anyUntil(MEMBER_STOP).as("return_type")).maybe());

    private final Rule member = seq(
            match("[+\\-#~]").as("visibility").maybe(),
            choice(method, anyUntil(MEMBER_STOP).as("attribute")));

    private final Rule body = seq(
            LBRACE,
            seq(WS, RBRACE.absent(), OPT_SPACES, member).repeat(0).as("members"),
            WS, RBRACE);

    private final Rule classStatement = seq(
            keyword("class"), SPACES, CLASS_NAME.as("class"),
            generic.maybe(),
            seq(OPT_SPACES, str("[\""), anyUntil(str("\"]")).as("class_label"), str("\"]")).maybe(),
            seq(OPT_SPACES, stereotype).maybe(),
            seq(OPT_SPACES, str(":::"), IDENTIFIER.as("css_class")).maybe(),
            seq(OPT_SPACES, body).maybe(),
            LINE_END);

    private final Rule stereotypeStatement = seq(
            stereotype, OPT_SPACES, CLASS_NAME.as("stereotype_of"), LINE_END);

    // Each operator before its prefixes; reversed operators point from target to source.
    private final Rule operator = choice(
            op("<|--", "inheritance", true),
            op("<|..", "realization", true),
            op("--|>", "inheritance", false),
            op("..|>", "realization", false),
            op("*--", "composition", false),
            op("--*", "composition", false),
            op("o--", "aggregation", false),
            seq(op("--o", "aggregation", false), match("[a-zA-Z0-9_]").absent()),
            op("-->", "association", false),
            op("<--", "association", true),
            op("..>", "dependency", false),
            op("<..", "dependency", true),
            op("--", "association", false),
            op("..", "association", false));

    private final Rule relationship = seq(
            CLASS_NAME.as("from"), OPT_SPACES,
            seq(QUOTED.as("from_card"), OPT_SPACES).maybe(),
            operator, OPT_SPACES,
            seq(QUOTED.as("to_card"), OPT_SPACES).maybe(),
            CLASS_NAME.as("to"),
            seq(OPT_SPACES, COLON, OPT_SPACES, REST_OF_LINE.as("label")).maybe(),
            LINE_END);

    private final Rule colonMember = seq(
            CLASS_NAME.as("member_of"), OPT_SPACES, COLON, OPT_SPACES, member, LINE_END);

    private final Rule note = seq(
            keyword("note"), SPACES,
            seq(keyword("for"), SPACES, CLASS_NAME.as("note_for"), SPACES).maybe(),
            QUOTED.as("note"), LINE_END);

    private final Rule link = seq(
            keyword("link"), SPACES, CLASS_NAME.as("link"), SPACES, QUOTED.as("href"),
            seq(SPACES, QUOTED.as("tooltip")).maybe(), LINE_END);

    private final Rule callback = seq(
            keyword("callback"), SPACES, CLASS_NAME.as("callback_of"), SPACES, QUOTED.as("callback"),
            seq(SPACES, QUOTED.as("tooltip")).maybe(), LINE_END);

    private final Rule click = seq(
            keyword("click"), SPACES, CLASS_NAME.as("click"), SPACES,
            choice(seq(keyword("href"), SPACES, QUOTED.as("href")),
                    seq(keyword("call"), SPACES, anyUntil(choice(SPACE, LINE_END)).as("callback"))),
            seq(SPACES, QUOTED.as("tooltip")).maybe(), LINE_END);

    private final Rule cssClass = seq(
            keyword("cssClass"), SPACES, QUOTED.as("css_targets"), SPACES, IDENTIFIER.as("css_class"),
            LINE_END);

    private final Rule classDef = seq(
            keyword("classDef"), SPACES, IDENTIFIER.as("class_def"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final RuleRef statement = ref("class statement");

    private final Rule namespace = seq(
            keyword("namespace"), SPACES, CLASS_NAME.as("namespace"), OPT_SPACES, LBRACE, LINE_END,
            seq(WS, RBRACE.absent(), statement).repeat(0).as("body"),
            WS, RBRACE, LINE_END);

    private final Rule root;

    public ClassDiagramGrammar() {
        statement.define(choice(
                namespace,
                direction,
                classStatement,
                stereotypeStatement,
                note,
                link,
                callback,
                click,
                cssClass,
                classDef,
                METADATA,
                relationship,
                colonMember,
                seq(CLASS_NAME.as("class"), LINE_END)));
        root = document(header, statement);
    }

    private static Rule op(String spelling, String kind, boolean reversed) {
        Rule plain = seq(str(spelling).as("operator"), constant("relation", kind));
        return reversed ? seq(plain, constant("reversed", "true")) : plain;
    }

    @Override
    protected Rule root() {
        return root;
    }
}
