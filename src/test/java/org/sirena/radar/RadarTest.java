package org.sirena.radar;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.radar.models.RadarAxis;
import org.sirena.radar.models.RadarChart;
import org.sirena.radar.models.RadarCurve;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RadarTest {

    private final DiagramParser<RadarChart> parser =
            new DiagramParser<>("radar", new RadarGrammar(), RadarTransform::new);

    @Test
    void shouldMapPositionalAndNamedValuesToAxes() {
        RadarChart chart = parser.parse("""
                radar-beta
                title Skills
                axis speed["Speed"], power, range
                curve a["Alpha"]{1, 2, 3}, b{range: 5, speed: 4}
                ticks 5
                graticule circle
                showLegend false
                max 6
                """);

        assertEquals(List.of(new RadarAxis("speed", "Speed"), new RadarAxis("power", "power"),
                new RadarAxis("range", "range")), chart.axes());
        assertEquals(new RadarCurve("a", "Alpha", Map.of("speed", 1.0, "power", 2.0, "range", 3.0)),
                chart.findCurve("a"));
        assertEquals(5.0, chart.valueOf("b", "range"));
        assertNull(chart.valueOf("b", "power"));
        assertEquals(5, chart.ticks());
        assertEquals("circle", chart.graticule());
        assertFalse(chart.showLegend());
        assertEquals(6.0, chart.max());
        assertEquals(5.0, chart.maxValue());
        assertTrue(chart.isValid());
    }

    @Test
    void shouldRejectMoreValuesThanAxes() {
        assertThrows(CanonicalizationException.class,
                () -> parser.parse("radar-beta\naxis x, y\ncurve c{1, 2, 3}\n"));
    }

    @Test
    void shouldReportUnknownNamedAxisAsInvalid() {
        RadarChart chart = parser.parse("radar-beta\naxis x\ncurve c{z: 1}\n");

        assertFalse(chart.isValid());
    }
}
