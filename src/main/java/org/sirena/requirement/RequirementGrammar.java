package org.sirena.requirement;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code requirementDiagram} documents.
 */
public class RequirementGrammar extends Grammar {

    private final Rule header = seq(keyword("requirementDiagram"), LINE_END);

    private final Rule name = choice(QUOTED, match("[a-zA-Z0-9_.]").repeat(1)).named("name");

    private final Rule classShorthand = seq(str(":::"), anyUntil(choice(SPACE, LBRACE, NEWLINE)).as("class_ref"));

    private final Rule property = seq(
            WS, IDENTIFIER.as("key"), OPT_SPACES, COLON, OPT_SPACES, REST_OF_LINE.as("value"), LINE_END);

    private final Rule body = seq(
            OPT_SPACES, LBRACE, LINE_END,
            property.repeat(0).as("properties"),
            WS, RBRACE, LINE_END);

    private final Rule requirement = seq(
            oneOf("requirement", "functionalRequirement", "interfaceRequirement",
                    "performanceRequirement", "physicalRequirement", "designConstraint").as("requirement_type"),
            SPACES, name.as("requirement"), classShorthand.maybe(), body);

    private final Rule element = seq(
            keyword("element"), SPACES, name.as("element"), classShorthand.maybe(), body);

    private final Rule relationType = oneOf(
            "contains", "copies", "derives", "satisfies", "verifies", "refines", "traces").as("relation");

    private final Rule relation = choice(
            seq(name.as("source"), SPACES, MINUS, SPACES, relationType, SPACES, str("->"), SPACES,
                    name.as("target"), LINE_END),
            seq(name.as("target"), SPACES, str("<-"), SPACES, relationType, SPACES, MINUS, SPACES,
                    name.as("source"), LINE_END));

    private final Rule direction = seq(
            keyword("direction"), SPACES, oneOf("TB", "BT", "LR", "RL").as("direction"), LINE_END);

    private final Rule style = seq(
            keyword("style"), SPACES, anyUntil(SPACE).as("style"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final Rule classDef = seq(
            keyword("classDef"), SPACES, anyUntil(SPACE).as("class_def"), SPACES, REST_OF_LINE.as("css"), LINE_END);

    private final Rule classStatement = seq(
            keyword("class"), SPACES, anyUntil(SPACE).as("class_targets"), SPACES,
            IDENTIFIER.as("class_name"), LINE_END);

    private final Rule root = document(header, choice(
            METADATA, direction, style, classDef, classStatement, requirement, element, relation));

    @Override
    protected Rule root() {
        return root;
    }
}
