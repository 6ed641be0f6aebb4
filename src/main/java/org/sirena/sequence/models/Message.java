package org.sirena.sequence.models;

import lombok.Builder;

/**
 * One arrow between two lifelines.
 *
 * @param index      position in document order, starting at 0
 * @param arrowType  solid, dotted, solid_open, dotted_open, solid_cross, dotted_cross, async or async_dotted
 * @param activate   the arrow carried a {@code +} suffix and opened an activation on the receiver
 * @param deactivate the arrow carried a {@code -} suffix and closed an activation on the sender
 */
@Builder
public record Message(
        int index,
        String fromId,
        String toId,
        String text,
        String arrowType,
        boolean activate,
        boolean deactivate
) {
    public Message {
        text = text == null ? "" : text;
    }
}
