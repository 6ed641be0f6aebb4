package org.sirena.sequence;

import org.sirena.diagram.ContextStack;
import org.sirena.diagram.EntityRegistry;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.sequence.models.Activation;
import org.sirena.sequence.models.BlockSection;
import org.sirena.sequence.models.Box;
import org.sirena.sequence.models.ControlBlock;
import org.sirena.sequence.models.Message;
import org.sirena.sequence.models.Note;
import org.sirena.sequence.models.Participant;
import org.sirena.sequence.models.SequenceDiagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks a sequence diagram tree in document order. Nested blocks share one message
 * counter and one activation stack per participant, so a block only records the index
 * range it spans.
 */
public class SequenceTransform implements Transform<SequenceDiagram> {

    private static final Logger logger = LoggerFactory.getLogger(SequenceTransform.class);

    private static final Pattern BOX_COLOR = Pattern.compile("^(rgba?\\([^)]*\\)|transparent)\\s*(.*)$");

    private final EntityRegistry<Participant> participants = new EntityRegistry<>(Participant::new);
    private final List<Message> messages = new ArrayList<>();
    private final List<Activation> activations = new ArrayList<>();
    private final Map<String, Deque<Integer>> openActivations = new LinkedHashMap<>();
    private final List<Note> notes = new ArrayList<>();
    private final List<BoxDraft> boxes = new ArrayList<>();
    private final List<BlockDraft> blocks = new ArrayList<>();
    private final ContextStack<BlockDraft> openBlocks = new ContextStack<>();
    private final ContextStack<BoxDraft> openBoxes = new ContextStack<>();
    private boolean autonumber;
    private String title;
    private String accTitle;
    private String accDescription;

    @Override
    public SequenceDiagram apply(Captures tree) {
        tree.records("statements").forEach(this::statement);

        // activations still open at the end of the document run to the last message
        openActivations.forEach((id, starts) -> {
            while (!starts.isEmpty()) {
                int start = starts.pop();
                activations.add(new Activation(id, start, Math.max(messages.size() - 1, start)));
            }
        });

        List<ControlBlock> builtBlocks = blocks.stream().map(BlockDraft::build).toList();
        logger.debug("Sequence diagram: {} participants, {} messages, {} blocks",
                participants.size(), messages.size(), blocks.size());
        return new SequenceDiagram(participants.values(), messages, activations, notes,
                boxes.stream().map(BoxDraft::build).toList(),
                new ArrayList<>(builtBlocks), autonumber, title, accTitle, accDescription);
    }

    private void statement(Captures stmt) {
        if (stmt.has("participant")) {
            declare(stmt);
        } else if (stmt.has("from")) {
            message(stmt);
        } else if (stmt.has("note")) {
            note(stmt);
        } else if (stmt.has("activate")) {
            activate(stmt.text("activate"));
        } else if (stmt.has("deactivate")) {
            deactivate(stmt.text("deactivate"));
        } else if (stmt.has("destroy")) {
            participants.findOrCreate(stmt.text("destroy")).setDestroyed(true);
        } else if (stmt.has("autonumber")) {
            autonumber = !stmt.text("autonumber").equals("off");
        } else if (stmt.has("box")) {
            box(stmt);
        } else if (stmt.has("block")) {
            block(stmt);
        } else if (stmt.has("acc_title")) {
            accTitle = stmt.text("acc_title");
        } else if (stmt.has("acc_descr")) {
            accDescription = stmt.text("acc_descr");
        } else if (stmt.has("title")) {
            title = stmt.text("title");
        }
    }

    private void declare(Captures stmt) {
        String id = stmt.text("participant");
        Participant participant = touch(id);
        participant.setKind(stmt.text("kind"));
        participant.setLabel(EntityRegistry.merge(participant.getLabel(), stmt.optText("alias")));
        if (stmt.has("created")) {
            participant.setCreated(true);
        }
    }

    private Participant touch(String id) {
        boolean known = participants.contains(id);
        Participant participant = participants.findOrCreate(id);
        if (!known) {
            openBoxes.current().ifPresent(b -> b.participantIds().add(id));
        }
        return participant;
    }

    private void message(Captures stmt) {
        String from = stmt.text("from");
        String to = stmt.text("to");
        touch(from);
        touch(to);
        String activation = stmt.optText("activation");
        boolean activating = activation.equals("activate");
        boolean deactivating = activation.equals("deactivate");
        // the activation starts with, and the deactivation ends at, this message
        if (activating) {
            activate(to);
        } else if (deactivating) {
            deactivate(from);
        }
        messages.add(Message.builder()
                .index(messages.size())
                .fromId(from)
                .toId(to)
                .text(stmt.optText("text"))
                .arrowType(stmt.text("arrow_type"))
                .activate(activating)
                .deactivate(deactivating)
                .build());
    }

    private void note(Captures stmt) {
        List<String> ids = new ArrayList<>();
        for (String id : stmt.text("note_participants").split(",")) {
            ids.add(id.trim());
            touch(id.trim());
        }
        notes.add(new Note(stmt.text("note"), stmt.text("position"), ids, messages.size()));
    }

    private void activate(String id) {
        touch(id);
        openActivations.computeIfAbsent(id, k -> new ArrayDeque<>()).push(messages.size());
    }

    private void deactivate(String id) {
        Deque<Integer> starts = openActivations.get(id);
        if (starts == null || starts.isEmpty()) {
            logger.debug("Ignoring deactivation of inactive participant {}", id);
            return;
        }
        activations.add(new Activation(id, starts.pop(), messages.size()));
    }

    private void box(Captures stmt) {
        String label = stmt.text("box");
        String color = null;
        Matcher m = BOX_COLOR.matcher(label);
        if (m.matches()) {
            color = m.group(1);
            label = m.group(2);
        }
        BoxDraft box = new BoxDraft(label, color, new ArrayList<>());
        boxes.add(box);
        openBoxes.within(box, () -> stmt.records("body").forEach(this::statement));
    }

    private void block(Captures stmt) {
        BlockDraft draft = new BlockDraft(stmt.text("block"), stmt.text("label"), messages.size(),
                openBlocks.current().map(blocks::indexOf).orElse(-1));
        blocks.add(draft);
        openBlocks.within(draft, () -> {
            draft.sections.add(new BlockSection(draft.label, messages.size()));
            stmt.records("body").forEach(this::statement);
            for (Captures branch : stmt.records("branches")) {
                draft.sections.add(new BlockSection(branch.text("label"), messages.size()));
                branch.records("body").forEach(this::statement);
            }
        });
        draft.endIndex = messages.size();
    }

    private record BoxDraft(String label, String color, List<String> participantIds) {
        Box build() {
            return new Box(label, color, participantIds);
        }
    }

    private static class BlockDraft {
        final String type;
        final String label;
        final int startIndex;
        final int parentIndex;
        final List<BlockSection> sections = new ArrayList<>();
        int endIndex;

        BlockDraft(String type, String label, int startIndex, int parentIndex) {
            this.type = type;
            this.label = label;
            this.startIndex = startIndex;
            this.parentIndex = parentIndex;
        }

        ControlBlock build() {
            return ControlBlock.builder()
                    .type(type)
                    .label(label)
                    .startIndex(startIndex)
                    .endIndex(endIndex)
                    .sections(sections)
                    .parentIndex(parentIndex)
                    .build();
        }
    }
}
