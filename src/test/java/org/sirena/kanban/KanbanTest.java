package org.sirena.kanban;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.kanban.models.KanbanBoard;
import org.sirena.kanban.models.KanbanCard;
import org.sirena.kanban.models.KanbanColumn;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KanbanTest {

    private final DiagramParser<KanbanBoard> parser =
            new DiagramParser<>("kanban", new KanbanGrammar(), KanbanTransform::new);

    @Test
    void shouldGroupCardsUnderColumns() {
        KanbanBoard board = parser.parse("""
                kanban
                  todo[Todo]
                    t1[Write docs]@{ assigned: 'alice', priority: 'High' }
                    t2[Review]@{ ticket: 42, team: core }
                  done[Done]
                    Ship it
                """);

        assertEquals(List.of("todo", "done"), board.columns().stream().map(KanbanColumn::id).toList());
        assertEquals("Todo", board.findColumn("todo").title());
        assertEquals(List.of("t1", "t2"), board.findColumn("todo").cards().stream().map(KanbanCard::id).toList());

        KanbanCard docs = board.findCard("t1");
        assertEquals("Write docs", docs.text());
        assertEquals("alice", docs.assigned());
        assertEquals(List.of(docs), board.cardsByPriority("High"));

        KanbanCard review = board.findCard("t2");
        assertEquals("42", review.ticket());
        assertEquals(Map.of("team", "core"), review.metadata());

        assertEquals("Ship it", board.findColumn("done").cards().get(0).text());
        assertEquals(List.of(docs), board.cardsByAssigned("alice"));
        assertTrue(board.isValid());
    }

    @Test
    void shouldAttachNestedCardsToTopColumn() {
        KanbanBoard board = parser.parse("kanban\ncol\n  a\n    b\n");

        assertEquals(List.of("a", "b"), board.findColumn("col").cards().stream().map(KanbanCard::id).toList());
    }

    @Test
    void shouldReportDuplicateCardIdsAsInvalid() {
        KanbanBoard board = parser.parse("kanban\ncol\n  x[One]\n  x[Two]\n");

        assertFalse(board.isValid());
    }

    @Test
    void shouldGenerateIdsForBracketedCardsWithoutId() {
        KanbanBoard board = parser.parse("""
                kanban
                  todo[Todo]
                    [Create doc]
                    [Review doc]@{ priority: 'Low' }
                """);

        List<KanbanCard> cards = board.findColumn("todo").cards();
        assertEquals(List.of("item-0", "item-1"), cards.stream().map(KanbanCard::id).toList());
        assertEquals(List.of("Create doc", "Review doc"), cards.stream().map(KanbanCard::text).toList());
        assertEquals("Low", cards.get(1).priority());
        assertTrue(board.isValid());
    }
}
