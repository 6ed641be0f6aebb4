package org.sirena.grammar;

/**
 * Base type of every failure raised while turning diagram text into a model.
 * A failing document never yields a partial model.
 */
public abstract class DiagramParseException extends RuntimeException {

    protected DiagramParseException(String message) {
        super(message);
    }

    protected DiagramParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Kind kind();

    public enum Kind {
        GRAMMAR,
        CANONICALIZATION
    }
}
