package org.sirena.mindmap;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code mindmap} documents. Every line keeps its indent; the hierarchy is
 * rebuilt by the transform.
 */
public class MindmapGrammar extends Grammar {

    private final Rule header = seq(keyword("mindmap"), LINE_END);

    private final Rule shape = choice(
            shape("((", "))", "circle"),
            shape("))", "((", "bang"),
            shape(")", "(", "cloud"),
            shape("{{", "}}", "hexagon"),
            shape("(", ")", "rounded"),
            shape("[", "]", "square"));

    private final Rule node = choice(
            seq(match("[a-zA-Z0-9_\\-]").repeat(0), shape),
            seq(REST_OF_LINE.as("text"), constant("shape", "default")));

    private final Rule icon = seq(str("::icon("), anyUntil(choice(RPAREN, NEWLINE)).as("icon"), RPAREN);

    private final Rule classes = seq(str(":::"), REST_OF_LINE.as("classes"));

    private final Rule line = seq(
            OPT_SPACES.as("indent"), choice(icon, classes, node), OPT_SPACES, LINE_END);

    private final Rule root = indentedDocument(header, line);

    private static Rule shape(String open, String close, String kind) {
        return seq(str(open), anyUntil(choice(str(close), NEWLINE)).as("text"), str(close), constant("shape", kind));
    }

    @Override
    protected Rule root() {
        return root;
    }
}
