package org.sirena.treemap;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.treemap.models.Treemap;
import org.sirena.treemap.models.TreemapNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreemapTest {

    private final DiagramParser<Treemap> parser =
            new DiagramParser<>("treemap", new TreemapGrammar(), TreemapTransform::new);

    @Test
    void shouldSumChildValuesIntoSections() {
        Treemap treemap = parser.parse("""
                treemap-beta
                title Budget
                classDef important fill:#f96;
                "Operations"
                    "Salaries": 700
                    "Rent": 150 :::important
                "Marketing"
                    "Ads": 120
                """);

        assertEquals("Budget", treemap.title());
        assertEquals("fill:#f96", treemap.classDefs().get("important"));
        assertEquals(List.of("Operations", "Marketing"), treemap.roots().stream().map(TreemapNode::label).toList());
        assertEquals(List.of("Salaries", "Rent"), treemap.childrenOf(0).stream().map(TreemapNode::label).toList());
        assertEquals("important", treemap.nodes().get(2).className());
        assertEquals(850, treemap.valueOf(0), 1e-9);
        assertEquals(970, treemap.totalValue(), 1e-9);
        assertEquals(1, treemap.depth());
        assertTrue(treemap.isValid());
    }

    @Test
    void shouldReportLeafWithoutValueAsInvalid() {
        Treemap treemap = parser.parse("treemap\n\"Root\"\n  \"Leaf\"\n");

        assertNull(treemap.nodes().get(1).value());
        assertFalse(treemap.isValid());
    }
}
