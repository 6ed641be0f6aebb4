package org.sirena.kanban.models;

import java.util.List;

public record KanbanColumn(String id, String title, List<KanbanCard> cards) {
    public KanbanColumn {
        cards = cards == null ? List.of() : List.copyOf(cards);
    }
}
