package org.sirena.classdiagram.models;

/**
 * A {@code link}, {@code click} or {@code callback} attached to a class.
 *
 * @param kind   {@code link} for URLs, {@code callback} for script functions
 * @param target URL or function name
 */
public record ClassInteraction(String classId, String kind, String target, String tooltip) {
}
