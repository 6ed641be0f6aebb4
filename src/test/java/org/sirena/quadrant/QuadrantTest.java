package org.sirena.quadrant;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.quadrant.models.QuadrantChart;
import org.sirena.quadrant.models.QuadrantPoint;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QuadrantTest {

    private final DiagramParser<QuadrantChart> parser =
            new DiagramParser<>("quadrant", new QuadrantGrammar(), QuadrantTransform::new);

    @Test
    void shouldParseAxesQuadrantsAndPoints() {
        QuadrantChart chart = parser.parse("""
                quadrantChart
                title Reach and engagement
                x-axis Low Reach --> High Reach
                y-axis Low Engagement --> High Engagement
                quadrant-1 We should expand
                quadrant-3 Re-evaluate
                classDef hot color: #ff3300
                Campaign A:::hot: [0.3, 0.6]
                Campaign B: [0.75, 0.8] radius: 12, color: #00ff00
                """);

        assertEquals("Low Reach", chart.xAxisLeft());
        assertEquals("High Reach", chart.xAxisRight());
        assertEquals("High Engagement", chart.yAxisTop());
        assertEquals(Map.of(1, "We should expand", 3, "Re-evaluate"), chart.quadrantLabels());

        QuadrantPoint a = chart.findPoint("Campaign A");
        assertEquals("hot", a.className());
        assertEquals(2, a.quadrant());

        QuadrantPoint b = chart.findPoint("Campaign B");
        assertEquals(12.0, b.radius());
        assertEquals("#00ff00", b.color());
        assertEquals(List.of(b), chart.pointsInQuadrant(1));
        assertTrue(chart.isValid());
    }

    @Test
    void shouldAllowAxisWithOneLabel() {
        QuadrantChart chart = parser.parse("quadrantChart\nx-axis Effort\n");

        assertEquals("Effort", chart.xAxisLeft());
        assertNull(chart.xAxisRight());
    }

    @Test
    void shouldReportPointOutsideUnitSquareAsInvalid() {
        assertFalse(parser.parse("quadrantChart\nFar: [1.5, 0.2]\n").isValid());
    }

    @Test
    void shouldReportUndefinedClassAsInvalid() {
        assertFalse(parser.parse("quadrantChart\nP:::missing: [0.2, 0.2]\n").isValid());
    }
}
