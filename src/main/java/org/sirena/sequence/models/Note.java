package org.sirena.sequence.models;

import java.util.List;

/**
 * @param position     left_of, right_of or over
 * @param messageIndex number of messages that precede the note
 */
public record Note(String text, String position, List<String> participantIds, int messageIndex) {
    public Note {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
    }
}
