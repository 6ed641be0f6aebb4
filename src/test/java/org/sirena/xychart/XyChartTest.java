package org.sirena.xychart;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.xychart.models.XyAxis;
import org.sirena.xychart.models.XyChart;
import org.sirena.xychart.models.XySeries;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XyChartTest {

    private final DiagramParser<XyChart> parser =
            new DiagramParser<>("xychart", new XyChartGrammar(), XyChartTransform::new);

    @Test
    void shouldParseAxesAndSeries() {
        XyChart chart = parser.parse("""
                xychart-beta horizontal
                title "Sales Revenue"
                x-axis "Month" [jan, feb, "mar"]
                y-axis Revenue 0 --> 100
                bar [50, 60, 75]
                line "Trend" [40, 55.5, 90]
                """);

        assertEquals("Sales Revenue", chart.title());
        assertEquals("horizontal", chart.orientation());
        assertEquals(new XyAxis("Month", List.of("jan", "feb", "mar"), null, null), chart.xAxis());
        assertTrue(chart.xAxis().isCategorical());
        assertEquals(new XyAxis("Revenue", List.of(), 0.0, 100.0), chart.yAxis());
        assertEquals(List.of(new XySeries("bar", null, List.of(50.0, 60.0, 75.0))), chart.seriesOfType("bar"));
        assertEquals(List.of(40.0, 55.5, 90.0), chart.findSeries("Trend").values());
        assertEquals(40.0, chart.minValue());
        assertEquals(90.0, chart.maxValue());
        assertTrue(chart.isValid());
    }

    @Test
    void shouldDefaultToVerticalOrientation() {
        XyChart chart = parser.parse("xychart-beta\nbar [1, 2]\n");

        assertEquals("vertical", chart.orientation());
        assertNull(chart.xAxis());
        assertTrue(chart.isValid());
    }

    @Test
    void shouldReportSeriesLengthMismatchAsInvalid() {
        XyChart chart = parser.parse("xychart-beta\nx-axis [a, b, c]\nline [1, 2]\n");

        assertFalse(chart.isValid());
    }
}
