package org.sirena.gantt;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.gantt.models.GanttChart;
import org.sirena.gantt.models.GanttSection;
import org.sirena.gantt.models.GanttTask;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GanttTest {

    private final DiagramParser<GanttChart> parser =
            new DiagramParser<>("gantt", new GanttGrammar(), () -> new GanttTransform("YYYY-MM-DD"));

    @Test
    void shouldResolveTaskDetailsBySection() {
        GanttChart chart = parser.parse("""
                gantt
                dateFormat YYYY-MM-DD
                title Launch
                excludes weekends
                Kickoff : k1, 2024-01-01, 1d
                section Build
                Design : done, des, 2024-01-02, 3d
                Implement : crit, impl, after des, 5d
                Release : milestone, rel, after impl, 0d
                click impl href "https://example.org"
                """);

        assertEquals("Launch", chart.title());
        assertEquals(List.of("weekends"), chart.excludes());
        assertEquals(List.of("Default", "Build"), chart.sections().stream().map(GanttSection::name).toList());

        GanttTask kickoff = chart.findSection("Default").tasks().get(0);
        assertEquals("Kickoff", kickoff.description());
        assertEquals("2024-01-01", kickoff.startDate());
        assertEquals("1d", kickoff.duration());

        GanttTask implement = chart.findTask("impl");
        assertEquals("des", implement.afterTask());
        assertEquals("5d", implement.duration());
        assertTrue(implement.hasTag("crit"));
        assertEquals("https://example.org", implement.clickHref());

        assertTrue(chart.findTask("rel").isMilestone());
        assertTrue(chart.findTask("des").hasTag("done"));
        assertTrue(chart.isValid());
    }

    @Test
    void shouldUseConfiguredDateFormatUntilDocumentOverridesIt() {
        DiagramParser<GanttChart> european =
                new DiagramParser<>("gantt", new GanttGrammar(), () -> new GanttTransform("DD-MM-YYYY"));

        assertEquals("DD-MM-YYYY", european.parse("gantt\nA : 01-02-2024, 2d\n").dateFormat());
        assertEquals("YYYY", european.parse("gantt\ndateFormat YYYY\nA : 2024, 2d\n").dateFormat());
    }

    @Test
    void shouldReadUntilAndEndDates() {
        GanttChart chart = parser.parse("""
                gantt
                section Ops
                First : a1, 2024-01-01, 2024-01-05
                Second : b1, 2024-01-02, until a1
                """);

        assertEquals("2024-01-05", chart.findTask("a1").endDate());
        assertEquals("a1", chart.findTask("b1").untilTask());
        assertTrue(chart.isValid());
    }

    @Test
    void shouldReportUnknownAfterReferenceAsInvalid() {
        GanttChart chart = parser.parse("gantt\nA : a1, after ghost, 2d\n");

        assertFalse(chart.isValid());
    }
}
