package org.sirena.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Concrete syntax tree produced by a {@link Grammar}. Every node is one of three shapes:
 * a {@link Leaf} holding a text span, a {@link Captures} record of named children, or a
 * {@link Sequence} of repeated structured children.
 * <p>
 * Transforms read the tree through the shape-specific accessors on {@link Captures};
 * asking for a capture in the wrong shape raises a {@link CanonicalizationException}.
 */
public interface CstNode {

    int start();

    int end();

    record Leaf(String text, int start, int end) implements CstNode {
        public boolean isEmpty() {
            return text.isEmpty();
        }
    }

    record Captures(Map<String, CstNode> captures, int start, int end) implements CstNode {

        public Captures {
            captures = Collections.unmodifiableMap(new LinkedHashMap<>(captures));
        }

        public static Captures empty(int at) {
            return new Captures(Map.of(), at, at);
        }

        public boolean has(String name) {
            return captures.containsKey(name);
        }

        /** The named child, or a {@link CanonicalizationException} when absent. */
        public CstNode node(String name) {
            CstNode child = captures.get(name);
            if (child == null) {
                throw new CanonicalizationException(
                        String.format("Missing capture '%s' (available: %s)", name, captures.keySet()));
            }
            return child;
        }

        /** The named child as a record. */
        public Captures record(String name) {
            return asCaptures(node(name), name);
        }

        /** Text of a required leaf capture, trimmed. */
        public String text(String name) {
            return asText(node(name), name).trim();
        }

        /** Text of an optional leaf capture, trimmed; empty string when absent. */
        public String optText(String name) {
            CstNode child = captures.get(name);
            return child == null ? "" : asText(child, name).trim();
        }

        /** Raw, untrimmed text of an optional leaf capture. */
        public String rawText(String name) {
            CstNode child = captures.get(name);
            return child == null ? "" : asText(child, name);
        }

        /** Items of a repeated capture. Absent or empty captures yield an empty list. */
        public List<CstNode> list(String name) {
            CstNode child = captures.get(name);
            if (child == null) {
                return List.of();
            }
            if (child instanceof Sequence seq) {
                return seq.items();
            }
            if (child instanceof Leaf leaf && leaf.isEmpty()) {
                return List.of();
            }
            return List.of(child);
        }

        /** Items of a repeated capture that are records; used for statement lists. */
        public List<Captures> records(String name) {
            return list(name).stream()
                    .map(n -> asCaptures(n, name))
                    .toList();
        }

        /** Texts of a repeated capture whose items are records holding {@code field}. */
        public List<String> texts(String name, String field) {
            return records(name).stream()
                    .map(r -> r.text(field))
                    .toList();
        }
    }

    record Sequence(List<CstNode> items, int start, int end) implements CstNode {
        public Sequence {
            items = List.copyOf(items);
        }
    }

    static String asText(CstNode node, String name) {
        if (node instanceof Leaf leaf) {
            return leaf.text();
        }
        throw new CanonicalizationException(
                String.format("Capture '%s' is a %s, expected text", name, node.getClass().getSimpleName()));
    }

    static Captures asCaptures(CstNode node, String name) {
        if (node instanceof Captures captures) {
            return captures;
        }
        if (node instanceof Leaf leaf && leaf.isEmpty()) {
            return Captures.empty(leaf.start());
        }
        throw new CanonicalizationException(
                String.format("Capture '%s' is a %s, expected a record", name, node.getClass().getSimpleName()));
    }
}
