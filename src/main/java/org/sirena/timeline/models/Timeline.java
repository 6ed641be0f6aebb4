package org.sirena.timeline.models;

import org.sirena.diagram.Diagram;

import java.util.List;
import java.util.stream.Stream;

/**
 * @param periods periods listed before the first section
 */
public record Timeline(
        String title,
        List<TimePeriod> periods,
        List<TimelineSection> sections,
        String accTitle,
        String accDescription
) implements Diagram {

    public Timeline {
        periods = periods == null ? List.of() : List.copyOf(periods);
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @Override
    public String diagramType() {
        return "timeline";
    }

    @Override
    public boolean isValid() {
        return !allPeriods().isEmpty();
    }

    /** Periods outside sections first, then each section's periods in order. */
    public List<TimePeriod> allPeriods() {
        return Stream.concat(periods.stream(), sections.stream().flatMap(s -> s.periods().stream())).toList();
    }

    public List<String> allEvents() {
        return allPeriods().stream().flatMap(p -> p.events().stream()).toList();
    }

    public TimePeriod findPeriod(String time) {
        return allPeriods().stream().filter(p -> p.time().equals(time)).findFirst().orElse(null);
    }
}
