package org.sirena.grammar;

/**
 * A PEG recognizer. {@link #parse(ParseState)} either returns the node it built and
 * leaves the state after the consumed text, or returns {@code null} with the position
 * restored to where it started.
 */
@FunctionalInterface
public interface Rule {

    CstNode parse(ParseState state);

    /** Wraps the result under a capture name. */
    default Rule as(String name) {
        return Rules.capture(name, this);
    }

    /** Zero or one occurrence. */
    default Rule maybe() {
        return Rules.repeat(this, 0, 1);
    }

    /** At least {@code min} occurrences. */
    default Rule repeat(int min) {
        return Rules.repeat(this, min, Integer.MAX_VALUE);
    }

    default Rule repeat(int min, int max) {
        return Rules.repeat(this, min, max);
    }

    /** Negative lookahead; never consumes. */
    default Rule absent() {
        return Rules.not(this);
    }

    /** Positive lookahead; never consumes. */
    default Rule present() {
        return Rules.lookahead(this);
    }

    /** Reports failures of this rule under a single name instead of its inner terminals. */
    default Rule named(String description) {
        return Rules.named(description, this);
    }
}
