package org.sirena.grammar;

/**
 * Forward reference to a rule, resolved once the grammar has defined it. Lets a
 * statement list and the nested block containing it refer to each other.
 */
public final class RuleRef implements Rule {

    private final String name;
    private Rule target;

    RuleRef(String name) {
        this.name = name;
    }

    public void define(Rule rule) {
        if (target != null) {
            throw new IllegalStateException("Rule '" + name + "' is already defined");
        }
        target = rule;
    }

    @Override
    public CstNode parse(ParseState state) {
        if (target == null) {
            throw new IllegalStateException("Rule '" + name + "' was used before being defined");
        }
        return target.parse(state);
    }
}
