package org.sirena.gantt.models;

import java.util.List;

public record GanttSection(String name, List<GanttTask> tasks) {
    public GanttSection {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
