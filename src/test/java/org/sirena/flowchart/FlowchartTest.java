package org.sirena.flowchart;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.flowchart.models.ClickAction;
import org.sirena.flowchart.models.Flowchart;
import org.sirena.flowchart.models.FlowchartEdge;
import org.sirena.flowchart.models.FlowchartNode;
import org.sirena.flowchart.models.FlowchartSubgraph;
import org.sirena.grammar.GrammarException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowchartTest {

    private final DiagramParser<Flowchart> parser =
            new DiagramParser<>("flowchart", new FlowchartGrammar(), () -> new FlowchartTransform("TB"));

    @Test
    void shouldParseNodesEdgesAndLabels() {
        Flowchart chart = parser.parse("""
                flowchart TD
                A[Start] --> B{Decision}
                B -->|Yes| C[Done]
                B -- No --> D
                """);

        assertEquals("TD", chart.direction());
        assertEquals(List.of("A", "B", "C", "D"), chart.nodes().stream().map(FlowchartNode::getId).toList());
        assertEquals("rhombus", chart.findNode("B").getShape());
        assertEquals("Decision", chart.findNode("B").getLabel());
        assertEquals(List.of(
                new FlowchartEdge("A", "B", "", "arrow"),
                new FlowchartEdge("B", "C", "Yes", "arrow"),
                new FlowchartEdge("B", "D", "No", "arrow")), chart.edges());
        assertEquals(2, chart.edgesFrom("B").size());
        assertEquals(1, chart.edgesTo("D").size());
        assertTrue(chart.isValid());
    }

    @Test
    void shouldDefaultImplicitLabelToId() {
        Flowchart chart = parser.parse("flowchart LR\nA --> B\n");

        assertEquals("B", chart.findNode("B").getLabel());
        assertEquals("rect", chart.findNode("B").getShape());
    }

    @Test
    void shouldMergeRedeclaredNodeWithoutLosingLabel() {
        Flowchart chart = parser.parse("""
                flowchart LR
                A[Start] --> B
                A --> C
                """);
        assertEquals("Start", chart.findNode("A").getLabel());

        Flowchart relabelled = parser.parse("""
                flowchart LR
                A[Start] --> B
                A[Begin]
                """);
        assertEquals("Begin", relabelled.findNode("A").getLabel());
        assertEquals(2, relabelled.nodes().size());
    }

    @Test
    void shouldRecognizeEveryArrowSpelling() {
        Flowchart chart = parser.parse("""
                flowchart LR
                A ==> B
                B -.-> C
                C --- D
                D --x E
                E --o F
                F-->G
                """);

        assertEquals(List.of("thick_arrow", "dotted_arrow", "line", "cross_end", "circle_end", "arrow"),
                chart.edges().stream().map(FlowchartEdge::arrowType).toList());
    }

    @Test
    void shouldNestNodesInSubgraphs() {
        Flowchart chart = parser.parse("""
                flowchart TB
                subgraph one [First group]
                  direction LR
                  a1 --> a2
                end
                subgraph two
                  b1
                end
                one --> two
                """);

        FlowchartSubgraph one = chart.findSubgraph("one");
        assertEquals("First group", one.title());
        assertEquals("LR", one.direction());
        assertEquals(List.of("a1", "a2"), one.nodeIds());
        assertEquals("two", chart.findSubgraph("two").title());
        assertNull(chart.findNode("one"));
        assertEquals(new FlowchartEdge("one", "two", "", "arrow"), chart.edges().get(1));
        assertTrue(chart.isValid());
    }

    @Test
    void shouldCollectStylingAndInteractions() {
        Flowchart chart = parser.parse("""
                flowchart LR
                A --> B
                classDef hot fill:#f96
                class A,B hot
                style A stroke:#333
                linkStyle 0 stroke:red
                click A href "https://example.com" "Open"
                B:::cold
                """);

        assertEquals("fill:#f96", chart.classDefs().get("hot"));
        assertEquals(List.of("hot"), chart.findNode("A").getClasses());
        assertEquals(List.of("hot", "cold"), chart.findNode("B").getClasses());
        assertEquals("stroke:#333", chart.styles().get("A"));
        assertEquals("stroke:red", chart.linkStyles().get(0));
        assertEquals(new ClickAction("A", "https://example.com", null, "Open", null), chart.clicks().get(0));
    }

    @Test
    void shouldUseConfiguredDirectionWhenHeaderHasNone() {
        Flowchart chart = parser.parse("graph\nA-->B\n");

        assertEquals("TB", chart.direction());
    }

    @Test
    void shouldRejectUnclosedShape() {
        GrammarException e = assertThrows(GrammarException.class, () -> parser.parse("flowchart TD\nA[Start"));

        assertEquals(2, e.getLine());
    }
}
