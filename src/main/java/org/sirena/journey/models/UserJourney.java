package org.sirena.journey.models;

import org.sirena.diagram.Diagram;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record UserJourney(
        String title,
        List<JourneySection> sections,
        String accTitle,
        String accDescription
) implements Diagram {

    public UserJourney {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @Override
    public String diagramType() {
        return "journey";
    }

    /** Valid when there is at least one task and every score lies in 1..5. */
    @Override
    public boolean isValid() {
        List<JourneyTask> tasks = allTasks();
        return !tasks.isEmpty() && tasks.stream().allMatch(t -> t.score() >= 1 && t.score() <= 5);
    }

    public List<JourneyTask> allTasks() {
        return sections.stream().flatMap(s -> s.tasks().stream()).toList();
    }

    /** Distinct actors in order of first appearance. */
    public List<String> allActors() {
        Set<String> actors = new LinkedHashSet<>();
        allTasks().forEach(t -> actors.addAll(t.actors()));
        return new ArrayList<>(actors);
    }

    public List<JourneyTask> tasksByScore(int score) {
        return allTasks().stream().filter(t -> t.score() == score).toList();
    }

    public List<JourneyTask> tasksByActor(String actor) {
        return allTasks().stream().filter(t -> t.actors().contains(actor)).toList();
    }
}
