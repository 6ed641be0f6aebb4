package org.sirena.gantt.models;

import lombok.Builder;
import org.sirena.diagram.Diagram;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Builder
public record GanttChart(
        String title,
        String dateFormat,
        String axisFormat,
        String tickInterval,
        String todayMarker,
        String weekday,
        boolean inclusiveEndDates,
        List<String> excludes,
        List<String> includes,
        List<GanttSection> sections,
        String accTitle,
        String accDescription
) implements Diagram {

    public GanttChart {
        excludes = excludes == null ? List.of() : List.copyOf(excludes);
        includes = includes == null ? List.of() : List.copyOf(includes);
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @Override
    public String diagramType() {
        return "gantt";
    }

    /** Valid when every {@code after} and {@code until} reference names a task id. */
    @Override
    public boolean isValid() {
        Set<String> ids = new HashSet<>();
        allTasks().forEach(t -> {
            if (t.id() != null) ids.add(t.id());
        });
        return allTasks().stream().allMatch(t ->
                (t.afterTask() == null || ids.containsAll(List.of(t.afterTask().split("\\s+"))))
                        && (t.untilTask() == null || ids.contains(t.untilTask())));
    }

    public List<GanttTask> allTasks() {
        return sections.stream().flatMap(s -> s.tasks().stream()).toList();
    }

    public GanttTask findTask(String id) {
        return allTasks().stream().filter(t -> id.equals(t.id())).findFirst().orElse(null);
    }

    public GanttSection findSection(String name) {
        return sections.stream().filter(s -> s.name().equals(name)).findFirst().orElse(null);
    }
}
