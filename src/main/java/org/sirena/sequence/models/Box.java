package org.sirena.sequence.models;

import java.util.List;

/**
 * Visual grouping of participants declared between {@code box} and {@code end}.
 */
public record Box(String label, String color, List<String> participantIds) {
    public Box {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
    }
}
