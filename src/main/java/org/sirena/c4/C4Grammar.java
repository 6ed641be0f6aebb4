package org.sirena.c4;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;
import org.sirena.grammar.RuleRef;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for the C4 family: {@code C4Context}, {@code C4Container}, {@code C4Component},
 * {@code C4Dynamic} and {@code C4Deployment}. Every statement is a macro call
 * {@code Name(arg, ..., $key="value")}; boundaries and deployment nodes may be followed
 * by a braced body.
 */
public class C4Grammar extends Grammar {

    private static final String[] ELEMENTS = {
            "Person", "Person_Ext",
            "System", "SystemDb", "SystemQueue", "System_Ext", "SystemDb_Ext", "SystemQueue_Ext",
            "Container", "ContainerDb", "ContainerQueue",
            "Container_Ext", "ContainerDb_Ext", "ContainerQueue_Ext",
            "Component", "ComponentDb", "ComponentQueue",
            "Component_Ext", "ComponentDb_Ext", "ComponentQueue_Ext"};

    private static final String[] BOUNDARIES = {
            "Enterprise_Boundary", "System_Boundary", "Container_Boundary", "Boundary",
            "Deployment_Node", "Node", "Node_L", "Node_R"};

    private static final String[] RELATIONS = {
            "Rel", "BiRel", "Rel_Back",
            "Rel_U", "Rel_Up", "Rel_D", "Rel_Down", "Rel_L", "Rel_Left", "Rel_R", "Rel_Right"};

    private final Rule header = seq(
            oneOf("C4Context", "C4Container", "C4Component", "C4Dynamic", "C4Deployment").as("c4_type"),
            LINE_END);

    // quoted values keep their content only; bare values run to the next comma or paren
    private final Rule value = choice(
            seq(QUOTED.as("value"), OPT_SPACES),
            anyUntil0(choice(COMMA, RPAREN, NEWLINE)).as("value"));

    private final Rule arg = choice(
            seq(str("$"), IDENTIFIER.as("key"), OPT_SPACES, EQUALS, OPT_SPACES, value),
            value);

    private final Rule args = seq(arg, seq(OPT_SPACES, COMMA, OPT_SPACES, arg).repeat(0)).as("args");

    private final RuleRef statement = ref("c4 statement");

    private final Rule body = seq(
            OPT_SPACES, LBRACE, LINE_END.maybe(),
            seq(WS, RBRACE.absent(), statement).repeat(0).as("body"),
            WS, RBRACE);

    private final Rule element = seq(call(ELEMENTS, "element"), LINE_END);

    private final Rule boundary = seq(call(BOUNDARIES, "boundary"), body.maybe(), LINE_END);

    private final Rule relation = seq(call(RELATIONS, "relation"), LINE_END);

    private final Rule layoutConfig = seq(call(new String[]{"UpdateLayoutConfig"}, "layout_config"), LINE_END);

    private final Rule styleUpdate = seq(
            call(new String[]{"UpdateElementStyle", "UpdateBoundaryStyle"}, "element_style"), LINE_END);

    private final Rule relStyleUpdate = seq(call(new String[]{"UpdateRelStyle"}, "rel_style"), LINE_END);

    private final Rule root;

    public C4Grammar() {
        statement.define(choice(
                METADATA, layoutConfig, styleUpdate, relStyleUpdate, boundary, relation, element));
        root = document(header, statement);
    }

    private Rule call(String[] macros, String name) {
        return seq(oneOf(macros).as(name), OPT_SPACES, LPAREN, OPT_SPACES, args, OPT_SPACES, RPAREN);
    }

    @Override
    protected Rule root() {
        return root;
    }
}
