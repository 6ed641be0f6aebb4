package org.sirena.sankey;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.sankey.models.SankeyDiagram;
import org.sirena.sankey.models.SankeyFlow;
import org.sirena.sankey.models.SankeyNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SankeyTest {

    private final DiagramParser<SankeyDiagram> parser =
            new DiagramParser<>("sankey", new SankeyGrammar(), SankeyTransform::new);

    @Test
    void shouldParseFlowsAndCreateNodes() {
        SankeyDiagram diagram = parser.parse("""
                sankey-beta
                title Energy
                Solar,Grid,10
                Wind,Grid,5.5
                Grid,"Homes, ""smart""\",12
                Grid[Power Grid]
                """);

        assertEquals("Energy", diagram.title());
        assertEquals(List.of("Solar", "Grid", "Wind", "Homes, \"smart\""),
                diagram.nodes().stream().map(SankeyNode::id).toList());
        assertEquals("Power Grid", diagram.findNode("Grid").label());
        assertEquals(new SankeyFlow("Grid", "Homes, \"smart\"", 12), diagram.flowsFrom("Grid").get(0));
        assertEquals(15.5, diagram.totalInflow("Grid"), 1e-9);
        assertEquals(12, diagram.totalOutflow("Grid"), 1e-9);
        assertEquals(List.of("Solar", "Wind"), diagram.sourceNodes().stream().map(SankeyNode::id).toList());
        assertEquals(List.of("Homes, \"smart\""), diagram.sinkNodes().stream().map(SankeyNode::id).toList());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldReportNegativeFlowAsInvalid() {
        assertFalse(parser.parse("sankey-beta\nA,B,-5\n").isValid());
    }
}
