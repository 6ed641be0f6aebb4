package org.sirena.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PEG combinators. Sequences and repetitions fold their children into one node:
 * <ul>
 *   <li>only text children: a {@link CstNode.Leaf} spanning the consumed input;</li>
 *   <li>only record children: one {@link CstNode.Captures} with all captures merged;</li>
 *   <li>any repeated children: a flat {@link CstNode.Sequence} of the structured items.</li>
 * </ul>
 */
public final class Rules {

    private Rules() {
    }

    public static Rule str(String literal) {
        String description = "'" + literal + "'";
        return state -> {
            if (state.lookingAt(literal)) {
                int start = state.pos();
                state.advance(literal.length());
                return new CstNode.Leaf(literal, start, state.pos());
            }
            state.expect(description);
            return null;
        };
    }

    /** Matches one character from a bracket expression, e.g. {@code match("[a-z0-9_]")}. */
    public static Rule match(String charClass) {
        return new CharClass(charClass);
    }

    public static Rule any() {
        return state -> {
            if (state.atEnd()) {
                state.expect("any character");
                return null;
            }
            int start = state.pos();
            state.advance(1);
            return new CstNode.Leaf(state.input().substring(start, start + 1), start, start + 1);
        };
    }

    public static Rule eof() {
        return state -> {
            if (state.atEnd()) {
                return new CstNode.Leaf("", state.pos(), state.pos());
            }
            state.expect("end of input");
            return null;
        };
    }

    public static Rule seq(Rule... rules) {
        List<Rule> parts = List.of(rules);
        return state -> {
            int start = state.pos();
            List<CstNode> results = new ArrayList<>(parts.size());
            for (Rule rule : parts) {
                CstNode result = rule.parse(state);
                if (result == null) {
                    state.reset(start);
                    return null;
                }
                results.add(result);
            }
            return combine(state.input(), start, state.pos(), results);
        };
    }

    /** Ordered choice: the first alternative that matches wins. */
    public static Rule choice(Rule... alternatives) {
        List<Rule> options = List.of(alternatives);
        return state -> {
            for (Rule option : options) {
                CstNode result = option.parse(state);
                if (result != null) {
                    return result;
                }
            }
            return null;
        };
    }

    /**
     * Ordered choice over literal spellings, tried longest first so that no spelling is
     * shadowed by one of its own prefixes.
     */
    public static Rule oneOf(String... spellings) {
        Rule[] sorted = Arrays.stream(spellings)
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Rules::str)
                .toArray(Rule[]::new);
        return choice(sorted);
    }

    static Rule repeat(Rule rule, int min, int max) {
        if (min == 0 && max == 1) {
            return optional(rule);
        }
        return state -> {
            int start = state.pos();
            List<CstNode> results = new ArrayList<>();
            while (results.size() < max) {
                int before = state.pos();
                CstNode result = rule.parse(state);
                if (result == null) {
                    break;
                }
                results.add(result);
                if (state.pos() == before) {
                    break;
                }
            }
            if (results.size() < min) {
                state.reset(start);
                return null;
            }
            return combineRepeat(state.input(), start, state.pos(), results);
        };
    }

    static Rule optional(Rule rule) {
        return state -> {
            CstNode result = rule.parse(state);
            return result != null ? result : new CstNode.Leaf("", state.pos(), state.pos());
        };
    }

    static Rule capture(String name, Rule rule) {
        return state -> {
            CstNode result = rule.parse(state);
            if (result == null) {
                return null;
            }
            Map<String, CstNode> captures = new LinkedHashMap<>();
            captures.put(name, result);
            return new CstNode.Captures(captures, result.start(), result.end());
        };
    }

    static Rule not(Rule rule) {
        return state -> {
            int start = state.pos();
            state.enterSilent();
            CstNode result;
            try {
                result = rule.parse(state);
            } finally {
                state.leaveSilent();
            }
            state.reset(start);
            if (result != null) {
                return null;
            }
            return new CstNode.Leaf("", start, start);
        };
    }

    static Rule lookahead(Rule rule) {
        return state -> {
            int start = state.pos();
            CstNode result = rule.parse(state);
            state.reset(start);
            return result == null ? null : new CstNode.Leaf("", start, start);
        };
    }

    static Rule named(String description, Rule rule) {
        return state -> {
            state.enterSilent();
            CstNode result;
            try {
                result = rule.parse(state);
            } finally {
                state.leaveSilent();
            }
            if (result == null) {
                state.expect(description);
            }
            return result;
        };
    }

    /** Consumes nothing and yields {@code {name: value}}; tags which alternative matched. */
    public static Rule constant(String name, String value) {
        return state -> {
            Map<String, CstNode> captures = new LinkedHashMap<>();
            captures.put(name, new CstNode.Leaf(value, state.pos(), state.pos()));
            return new CstNode.Captures(captures, state.pos(), state.pos());
        };
    }

    /** One or more characters up to (not including) the point where {@code stop} matches. */
    public static Rule anyUntil(Rule stop) {
        return seq(stop.absent(), any()).repeat(1);
    }

    /** Like {@link #anyUntil(Rule)} but may match nothing. */
    public static Rule anyUntil0(Rule stop) {
        return seq(stop.absent(), any()).repeat(0);
    }

    /** A rule that can be defined after use, for mutually recursive statement lists. */
    public static RuleRef ref(String name) {
        return new RuleRef(name);
    }

    private static CstNode combine(String input, int start, int end, List<CstNode> parts) {
        List<CstNode> structured = parts.stream()
                .filter(p -> !(p instanceof CstNode.Leaf))
                .toList();
        if (structured.isEmpty()) {
            return new CstNode.Leaf(input.substring(start, end), start, end);
        }
        if (structured.size() == 1) {
            return structured.get(0);
        }
        boolean anySequence = structured.stream().anyMatch(CstNode.Sequence.class::isInstance);
        if (!anySequence) {
            Map<String, CstNode> merged = new LinkedHashMap<>();
            for (CstNode node : structured) {
                merged.putAll(((CstNode.Captures) node).captures());
            }
            return new CstNode.Captures(merged, start, end);
        }
        return new CstNode.Sequence(flatten(structured), start, end);
    }

    private static CstNode combineRepeat(String input, int start, int end, List<CstNode> parts) {
        List<CstNode> structured = parts.stream()
                .filter(p -> !(p instanceof CstNode.Leaf))
                .toList();
        if (structured.isEmpty()) {
            return new CstNode.Leaf(input.substring(start, end), start, end);
        }
        return new CstNode.Sequence(flatten(structured), start, end);
    }

    private static List<CstNode> flatten(List<CstNode> nodes) {
        List<CstNode> items = new ArrayList<>();
        for (CstNode node : nodes) {
            if (node instanceof CstNode.Sequence seq) {
                items.addAll(seq.items());
            } else {
                items.add(node);
            }
        }
        return items;
    }
}
