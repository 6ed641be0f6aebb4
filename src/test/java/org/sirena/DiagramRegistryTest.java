package org.sirena;

import org.junit.jupiter.api.Test;
import org.sirena.config.ConfigHelper;
import org.sirena.config.models.ParserConfig;
import org.sirena.diagram.Diagram;
import org.sirena.diagram.DiagramParser;
import org.sirena.flowchart.models.Flowchart;
import org.sirena.gantt.models.GanttChart;
import org.sirena.packet.models.PacketDiagram;
import org.sirena.pie.PieGrammar;
import org.sirena.pie.PieTransform;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagramRegistryTest {

    private static final List<String> ALL_TYPES = List.of(
            "flowchart", "sequence", "class", "state", "er", "journey", "gantt", "pie", "timeline",
            "quadrant", "gitgraph", "mindmap", "kanban", "radar", "block", "requirement", "xychart",
            "architecture", "sankey", "packet", "treemap", "c4", "info", "error");

    @Test
    void shouldRegisterEveryBuiltInType() {
        DiagramRegistry registry = DiagramRegistry.defaults(ParserConfig.defaults());

        assertEquals(ALL_TYPES, List.copyOf(registry.types()));
        assertTrue(registry.get("mindmap").isPresent());
        assertTrue(registry.get("unknown").isEmpty());
    }

    @Test
    void shouldDispatchOnDetectedHeader() {
        DiagramRegistry registry = DiagramRegistry.defaults(ParserConfig.defaults());

        Diagram diagram = registry.parse("%% greeting\ngraph TD\nA --> B\n");

        assertEquals("flowchart", diagram.diagramType());
        assertEquals("TD", ((Flowchart) diagram).direction());
        assertEquals("pie", registry.parse("pie\n\"a\" : 1\n").diagramType());
        assertEquals("c4", registry.parse("C4Context\nPerson(p, \"P\")\n").diagramType());
    }

    @Test
    void shouldApplyConfigurationToTransforms() {
        ParserConfig config = ConfigHelper.loadFromResources("configs/lenient_sirena.json");
        DiagramRegistry registry = DiagramRegistry.defaults(config);

        assertEquals("LR", ((Flowchart) registry.parse("flowchart\nA --> B\n")).direction());
        assertEquals("DD-MM-YYYY", ((GanttChart) registry.parse("gantt\nA : 2d\n")).dateFormat());
        assertEquals(16, ((PacketDiagram) registry.parse("packet-beta\n0-7: \"a\"\n")).bitsPerRow());
        assertFalse(registry.parse("journey\nsection S\n  Nap: 9: Me\n").isValid());
    }

    @Test
    void shouldRejectDisabledType() {
        ParserConfig config = ConfigHelper.loadFromResources("configs/lenient_sirena.json");
        DiagramRegistry registry = DiagramRegistry.defaults(config);

        assertFalse(registry.isRegistered("c4"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> registry.parse("C4Context\nPerson(p, \"P\")\n"));
        assertEquals("Unsupported diagram type: c4", e.getMessage());
    }

    @Test
    void shouldRejectUnknownHeader() {
        DiagramRegistry registry = DiagramRegistry.defaults(ParserConfig.defaults());

        assertThrows(IllegalArgumentException.class, () -> registry.parse("notADiagram\n"));
    }

    @Test
    void shouldRegisterAndClearParsers() {
        DiagramRegistry registry = new DiagramRegistry();
        registry.register(new DiagramParser<>("pie", new PieGrammar(), PieTransform::new));

        assertEquals(List.of("pie"), List.copyOf(registry.types()));
        assertEquals("pie", registry.parse("pie\n\"x\" : 2\n").diagramType());

        registry.clear();
        assertTrue(registry.types().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> registry.parse("pie\n\"x\" : 2\n"));
    }
}
