package org.sirena.gantt.models;

import lombok.Builder;

import java.util.List;

/**
 * A bar on the chart. Timing fields hold the document's text as written; resolving
 * them to calendar dates is left to the layout stage.
 *
 * @param tags      any of done, active, crit and milestone
 * @param afterTask id the task starts after, null when it has a start date
 * @param untilTask id the task runs until, null when it has an end or duration
 */
@Builder(toBuilder = true)
public record GanttTask(
        String id,
        String description,
        List<String> tags,
        String startDate,
        String endDate,
        String duration,
        String afterTask,
        String untilTask,
        String clickHref,
        String clickCallback
) {
    public GanttTask {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public boolean isMilestone() {
        return hasTag("milestone");
    }
}
