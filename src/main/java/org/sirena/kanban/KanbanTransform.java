package org.sirena.kanban;

import org.sirena.diagram.IndentationTree;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.kanban.models.KanbanBoard;
import org.sirena.kanban.models.KanbanCard;
import org.sirena.kanban.models.KanbanColumn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link KanbanBoard}: root lines of the indentation tree are columns, every
 * deeper line is a card of the column it descends from. A bare {@code [text]} line gets
 * a generated {@code item-N} id.
 */
public class KanbanTransform implements Transform<KanbanBoard> {

    private record ColumnHeading(String id, String title) {
    }

    private int anonymousCounter;

    @Override
    public KanbanBoard apply(Captures tree) {
        List<Captures> lines = tree.records("statements");
        List<Integer> indents = lines.stream().map(l -> l.rawText("indent").length()).toList();
        IndentationTree.Layout layout = IndentationTree.build(indents);

        Map<Integer, ColumnHeading> columnByLine = new LinkedHashMap<>();
        Map<Integer, List<KanbanCard>> cardsByLine = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            Captures line = lines.get(i);
            String text = line.text("text");
            String id = id(line, text);
            if (layout.level(i) == 0) {
                columnByLine.put(i, new ColumnHeading(id, text));
                cardsByLine.put(i, new ArrayList<>());
                continue;
            }
            int top = i;
            while (layout.parent(top) >= 0) {
                top = layout.parent(top);
            }
            cardsByLine.get(top).add(card(id, text, line));
        }

        List<KanbanColumn> columns = new ArrayList<>();
        columnByLine.forEach((lineIndex, column) ->
                columns.add(new KanbanColumn(column.id(), column.title(), cardsByLine.get(lineIndex))));
        return new KanbanBoard(columns);
    }

    private String id(Captures line, String text) {
        if (line.has("id")) {
            return line.text("id");
        }
        return line.has("anonymous") ? "item-" + anonymousCounter++ : text;
    }

    private static KanbanCard card(String id, String text, Captures line) {
        Map<String, String> extra = new LinkedHashMap<>();
        KanbanCard.KanbanCardBuilder card = KanbanCard.builder().id(id).text(text);
        for (Captures pair : line.records("metadata")) {
            String value = pair.text("value");
            switch (pair.text("key")) {
                case "assigned" -> card.assigned(value);
                case "ticket" -> card.ticket(value);
                case "icon" -> card.icon(value);
                case "label" -> card.label(value);
                case "priority" -> card.priority(value);
                default -> extra.put(pair.text("key"), value);
            }
        }
        return card.metadata(extra).build();
    }
}
