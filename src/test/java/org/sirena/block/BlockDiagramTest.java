package org.sirena.block;

import org.junit.jupiter.api.Test;
import org.sirena.block.models.Block;
import org.sirena.block.models.BlockDiagram;
import org.sirena.block.models.BlockEdge;
import org.sirena.diagram.DiagramParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockDiagramTest {

    private final DiagramParser<BlockDiagram> parser =
            new DiagramParser<>("block", new BlockGrammar(), BlockTransform::new);

    @Test
    void shouldParseRowsCompoundsAndConnections() {
        BlockDiagram diagram = parser.parse("""
                block-beta
                columns 3
                a["Start"] space b((Mid))
                block:group1:2
                  columns 2
                  c d
                end
                arrow<["Go"]>(right)
                a --> b
                b -- "next" --> c
                """);

        assertEquals(3, diagram.columns());
        assertEquals(List.of("a", "space-0", "b", "group1", "arrow"),
                diagram.topLevel().stream().map(Block::getId).toList());

        Block start = diagram.findBlock("a");
        assertEquals("square", start.getType());
        assertEquals("Start", start.getLabel());
        assertEquals("circle", diagram.findBlock("b").getType());
        assertEquals("space", diagram.findBlock("space-0").getType());

        Block group = diagram.findBlock("group1");
        assertTrue(group.isCompound());
        assertEquals(2, group.getWidth());
        assertEquals(2, group.getColumns());
        assertEquals(List.of("c", "d"), diagram.childrenOf("group1").stream().map(Block::getId).toList());

        Block arrow = diagram.findBlock("arrow");
        assertEquals("block_arrow", arrow.getType());
        assertEquals("Go", arrow.getLabel());
        assertEquals("right", arrow.getArrowDirection());

        assertEquals(List.of(new BlockEdge("a", "b", null, "arrow"), new BlockEdge("b", "c", "next", "arrow")),
                diagram.edges());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldNumberAnonymousCompounds() {
        BlockDiagram diagram = parser.parse("""
                block-beta
                block
                  x
                end
                block
                  y
                end
                """);

        assertEquals("compound-0", diagram.findBlock("x").getParentId());
        assertEquals("compound-1", diagram.findBlock("y").getParentId());
    }
}
