package org.sirena.sequence.models;

import lombok.Builder;

import java.util.List;

/**
 * A {@code loop}, {@code alt}, {@code opt}, {@code par}, {@code critical}, {@code break}
 * or {@code rect} region over a range of message indexes.
 *
 * @param startIndex  index of the first message the block may contain
 * @param endIndex    number of messages read when the block closed
 * @param parentIndex position of the enclosing block in the diagram's block list, -1 at top level
 */
@Builder
public record ControlBlock(
        String type,
        String label,
        int startIndex,
        int endIndex,
        List<BlockSection> sections,
        int parentIndex
) {
    public ControlBlock {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public boolean contains(int messageIndex) {
        return messageIndex >= startIndex && messageIndex < endIndex;
    }
}
