package org.sirena.pie;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.grammar.GrammarException;
import org.sirena.pie.models.PieChart;
import org.sirena.pie.models.PieSlice;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PieTest {

    private final DiagramParser<PieChart> parser = new DiagramParser<>("pie", new PieGrammar(), PieTransform::new);

    @Test
    void shouldParseSlicesAndHeaderOptions() {
        PieChart chart = parser.parse("""
                pie showData title Pets
                "Dogs" : 386
                "Cats" : 85.5
                'Rats' : 14.5
                """);

        assertEquals("Pets", chart.title());
        assertTrue(chart.showData());
        assertEquals(List.of(new PieSlice("Dogs", 386), new PieSlice("Cats", 85.5), new PieSlice("Rats", 14.5)),
                chart.slices());
        assertEquals(486, chart.totalValue(), 1e-9);
        assertEquals(14.5 * 100 / 486, chart.percentage("Rats"), 1e-9);
        assertEquals(0, chart.percentage("Birds"));
        assertTrue(chart.isValid());
    }

    @Test
    void shouldReadTitleFromStatement() {
        PieChart chart = parser.parse("pie\ntitle Budget\n\"Rent\" : 1\n");

        assertEquals("Budget", chart.title());
        assertFalse(chart.showData());
    }

    @Test
    void shouldTreatChartWithoutSlicesAsInvalid() {
        assertFalse(parser.parse("pie\n").isValid());
    }

    @Test
    void shouldRejectNonNumericValue() {
        assertThrows(GrammarException.class, () -> parser.parse("pie\n\"Dogs\" : many\n"));
    }

    @Test
    void shouldCopySlicesOnConstruction() {
        List<PieSlice> slices = new ArrayList<>(List.of(new PieSlice("Dogs", 3)));
        PieChart chart = new PieChart(null, false, slices, null, null);

        slices.clear();

        assertEquals(1, chart.slices().size());
        assertThrows(UnsupportedOperationException.class, () -> chart.slices().add(new PieSlice("Cats", 1)));
    }
}
