package org.sirena.gantt;

import org.sirena.diagram.Transform;
import org.sirena.gantt.models.GanttChart;
import org.sirena.gantt.models.GanttSection;
import org.sirena.gantt.models.GanttTask;
import org.sirena.grammar.CstNode.Captures;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds a {@link GanttChart}. Click handlers may appear before or after the task they
 * target, so tasks are kept as builders until the whole document has been read.
 */
public class GanttTransform implements Transform<GanttChart> {

    static final String DEFAULT_SECTION = "Default";

    private static final Set<String> TAGS = Set.of("done", "active", "crit", "milestone");
    private static final Pattern DURATION = Pattern.compile("^\\d+(\\.\\d+)?(ms|[smhdwy])$");

    private final String defaultDateFormat;
    private final GanttChart.GanttChartBuilder chart = GanttChart.builder();
    private final Map<String, List<GanttTask.GanttTaskBuilder>> sections = new LinkedHashMap<>();
    private final Map<String, String[]> clicks = new HashMap<>();
    private final List<String> excludes = new ArrayList<>();
    private final List<String> includes = new ArrayList<>();
    private String currentSection;

    public GanttTransform(String defaultDateFormat) {
        this.defaultDateFormat = defaultDateFormat;
    }

    @Override
    public GanttChart apply(Captures tree) {
        chart.dateFormat(defaultDateFormat);
        for (Captures stmt : tree.records("statements")) {
            statement(stmt);
        }
        List<GanttSection> built = new ArrayList<>();
        sections.forEach((name, tasks) -> built.add(new GanttSection(name,
                new ArrayList<>(tasks.stream().map(GanttTask.GanttTaskBuilder::build).map(this::withClick).toList()))));
        return chart.excludes(excludes).includes(includes).sections(built).build();
    }

    private void statement(Captures stmt) {
        if (stmt.has("task")) {
            task(stmt);
        } else if (stmt.has("section")) {
            currentSection = stmt.text("section");
            sections.computeIfAbsent(currentSection, k -> new ArrayList<>());
        } else if (stmt.has("click")) {
            clicks.put(stmt.text("click"), new String[]{
                    stmt.has("href") ? stmt.text("href") : null,
                    stmt.has("callback") ? stmt.text("callback") : null});
        } else if (stmt.has("date_format")) {
            chart.dateFormat(stmt.text("date_format"));
        } else if (stmt.has("axis_format")) {
            chart.axisFormat(stmt.text("axis_format"));
        } else if (stmt.has("tick_interval")) {
            chart.tickInterval(stmt.text("tick_interval"));
        } else if (stmt.has("today_marker")) {
            chart.todayMarker(stmt.text("today_marker"));
        } else if (stmt.has("weekday")) {
            chart.weekday(stmt.text("weekday"));
        } else if (stmt.has("excludes")) {
            excludes.add(stmt.text("excludes"));
        } else if (stmt.has("includes")) {
            includes.add(stmt.text("includes"));
        } else if (stmt.has("inclusive_end_dates")) {
            chart.inclusiveEndDates(true);
        } else if (stmt.has("acc_title")) {
            chart.accTitle(stmt.text("acc_title"));
        } else if (stmt.has("acc_descr")) {
            chart.accDescription(stmt.text("acc_descr"));
        } else if (stmt.has("title")) {
            chart.title(stmt.text("title"));
        }
    }

    private void task(Captures stmt) {
        if (currentSection == null) {
            currentSection = DEFAULT_SECTION;
        }
        List<String> parts = new ArrayList<>(stmt.texts("details", "detail"));
        List<String> tags = new ArrayList<>();
        while (!parts.isEmpty() && TAGS.contains(parts.get(0))) {
            tags.add(parts.remove(0));
        }
        GanttTask.GanttTaskBuilder task = GanttTask.builder()
                .description(stmt.text("task"))
                .tags(tags);
        switch (parts.size()) {
            case 0 -> { }
            case 1 -> end(task, parts.get(0));
            case 2 -> {
                start(task, parts.get(0));
                end(task, parts.get(1));
            }
            default -> {
                task.id(parts.get(0));
                start(task, parts.get(1));
                end(task, parts.get(2));
            }
        }
        sections.computeIfAbsent(currentSection, k -> new ArrayList<>()).add(task);
    }

    private static void start(GanttTask.GanttTaskBuilder task, String text) {
        if (text.startsWith("after ")) {
            task.afterTask(text.substring("after ".length()).trim());
        } else {
            task.startDate(text);
        }
    }

    private static void end(GanttTask.GanttTaskBuilder task, String text) {
        if (text.startsWith("until ")) {
            task.untilTask(text.substring("until ".length()).trim());
        } else if (text.startsWith("after ")) {
            task.afterTask(text.substring("after ".length()).trim());
        } else if (DURATION.matcher(text).matches()) {
            task.duration(text);
        } else {
            task.endDate(text);
        }
    }

    private GanttTask withClick(GanttTask task) {
        String[] click = task.id() == null ? null : clicks.get(task.id());
        if (click == null) {
            return task;
        }
        return task.toBuilder().clickHref(click[0]).clickCallback(click[1]).build();
    }
}
