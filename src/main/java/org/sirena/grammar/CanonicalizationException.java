package org.sirena.grammar;

/**
 * Raised when a syntactically valid tree breaks a modelling rule, or when a capture a
 * transform depends on is missing from the tree.
 */
public class CanonicalizationException extends DiagramParseException {

    public CanonicalizationException(String message) {
        super(message);
    }

    public CanonicalizationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Kind kind() {
        return Kind.CANONICALIZATION;
    }
}
