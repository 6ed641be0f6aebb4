package org.sirena.sequence.models;

/**
 * Span of messages during which a participant is active.
 *
 * @param startIndex index of the first message inside the span
 * @param endIndex   index of the message that closed the span
 */
public record Activation(String participantId, int startIndex, int endIndex) {
}
