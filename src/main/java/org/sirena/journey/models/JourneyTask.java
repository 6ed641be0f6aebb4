package org.sirena.journey.models;

import java.util.List;

/**
 * @param score satisfaction from 1 (worst) to 5 (best)
 */
public record JourneyTask(String name, int score, List<String> actors) {
    public JourneyTask {
        actors = actors == null ? List.of() : List.copyOf(actors);
    }
}
