package org.sirena.sequence.models;

import org.sirena.diagram.Diagram;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record SequenceDiagram(
        List<Participant> participants,
        List<Message> messages,
        List<Activation> activations,
        List<Note> notes,
        List<Box> boxes,
        List<ControlBlock> blocks,
        boolean autonumber,
        String title,
        String accTitle,
        String accDescription
) implements Diagram {

    public SequenceDiagram {
        participants = participants == null ? List.of() : List.copyOf(participants);
        messages = messages == null ? List.of() : List.copyOf(messages);
        activations = activations == null ? List.of() : List.copyOf(activations);
        notes = notes == null ? List.of() : List.copyOf(notes);
        boxes = boxes == null ? List.of() : List.copyOf(boxes);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    @Override
    public String diagramType() {
        return "sequence";
    }

    /**
     * Valid when there is at least one participant and every message, note and
     * activation names a known participant.
     */
    @Override
    public boolean isValid() {
        if (participants.isEmpty()) {
            return false;
        }
        Set<String> ids = new HashSet<>();
        participants.forEach(p -> ids.add(p.getId()));
        return messages.stream().allMatch(m -> ids.contains(m.fromId()) && ids.contains(m.toId()))
                && notes.stream().allMatch(n -> ids.containsAll(n.participantIds()))
                && activations.stream().allMatch(a -> ids.contains(a.participantId()));
    }

    public Participant findParticipant(String id) {
        return participants.stream().filter(p -> p.getId().equals(id)).findFirst().orElse(null);
    }

    public List<Message> messagesFrom(String participantId) {
        return messages.stream().filter(m -> m.fromId().equals(participantId)).toList();
    }

    public List<Message> messagesTo(String participantId) {
        return messages.stream().filter(m -> m.toId().equals(participantId)).toList();
    }

    public List<Activation> activationsFor(String participantId) {
        return activations.stream().filter(a -> a.participantId().equals(participantId)).toList();
    }

    /** Blocks whose range covers the given message, outermost first. */
    public List<ControlBlock> blocksAround(int messageIndex) {
        return blocks.stream().filter(b -> b.contains(messageIndex)).toList();
    }
}
