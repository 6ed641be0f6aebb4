package org.sirena.kanban.models;

import org.sirena.diagram.Diagram;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record KanbanBoard(List<KanbanColumn> columns) implements Diagram {

    public KanbanBoard {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    @Override
    public String diagramType() {
        return "kanban";
    }

    /** Valid when column ids and card ids are each unique. */
    @Override
    public boolean isValid() {
        Set<String> columnIds = new HashSet<>();
        Set<String> cardIds = new HashSet<>();
        return columns.stream().allMatch(c -> columnIds.add(c.id()))
                && allCards().stream().allMatch(c -> cardIds.add(c.id()));
    }

    public List<KanbanCard> allCards() {
        return columns.stream().flatMap(c -> c.cards().stream()).toList();
    }

    public KanbanColumn findColumn(String id) {
        return columns.stream().filter(c -> c.id().equals(id)).findFirst().orElse(null);
    }

    public KanbanCard findCard(String id) {
        return allCards().stream().filter(c -> c.id().equals(id)).findFirst().orElse(null);
    }

    public List<KanbanCard> cardsByAssigned(String assignee) {
        return allCards().stream().filter(c -> assignee.equals(c.assigned())).toList();
    }

    public List<KanbanCard> cardsByPriority(String priority) {
        return allCards().stream().filter(c -> priority.equals(c.priority())).toList();
    }
}
