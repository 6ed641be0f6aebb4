package org.sirena.journey.models;

import java.util.List;

/**
 * Named group of tasks. Tasks listed before the first {@code section} line are kept in
 * a section with an empty name.
 */
public record JourneySection(String name, List<JourneyTask> tasks) {
    public JourneySection {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
