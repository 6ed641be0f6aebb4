package org.sirena.sequence.models;

/**
 * A branch of a control block: the opening one, or an {@code else}, {@code and} or
 * {@code option} branch.
 */
public record BlockSection(String label, int startIndex) {
}
