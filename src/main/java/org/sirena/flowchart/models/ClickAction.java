package org.sirena.flowchart.models;

/**
 * Interaction bound to a node by a {@code click} statement. Exactly one of
 * {@code href} and {@code callback} is set.
 */
public record ClickAction(
        String nodeId,
        String href,
        String callback,
        String tooltip,
        String target
) {
}
