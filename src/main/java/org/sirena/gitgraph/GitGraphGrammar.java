package org.sirena.gitgraph;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code gitGraph} documents.
 */
public class GitGraphGrammar extends Grammar {

    private static final Rule BRANCH_NAME = choice(
            QUOTED,
            match("[a-zA-Z0-9_\\-./]").repeat(1)).named("branch name");

    private final Rule header = seq(
            str("gitGraph"), match("[a-zA-Z0-9_]").absent(),
            seq(OPT_SPACES, oneOf("LR", "TB", "BT").as("direction")).maybe(),
            OPT_SPACES, COLON.maybe(), LINE_END);

    private final Rule options = seq(SPACES, choice(
            option("id", QUOTED),
            option("type", oneOf("NORMAL", "REVERSE", "HIGHLIGHT")),
            option("tag", QUOTED),
            option("parent", QUOTED),
            option("order", INTEGER))).repeat(0).as("options");

    private final Rule commit = seq(keyword("commit"), constant("command", "commit"), options, LINE_END);

    private final Rule branch = seq(
            keyword("branch"), constant("command", "branch"), SPACES, BRANCH_NAME.as("branch"), options, LINE_END);

    private final Rule checkout = seq(
            choice(keyword("checkout"), keyword("switch")), constant("command", "checkout"),
            SPACES, BRANCH_NAME.as("branch"), LINE_END);

    private final Rule merge = seq(
            keyword("merge"), constant("command", "merge"), SPACES, BRANCH_NAME.as("branch"), options, LINE_END);

    private final Rule cherryPick = seq(keyword("cherry-pick"), constant("command", "cherry_pick"), options, LINE_END);

    private final Rule root = document(header, choice(METADATA, commit, branch, checkout, merge, cherryPick));

    private static Rule option(String name, Rule value) {
        return seq(keyword(name), OPT_SPACES, COLON, OPT_SPACES, value.as(name));
    }

    @Override
    protected Rule root() {
        return root;
    }
}
