package org.sirena.journey;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.journey.models.JourneySection;
import org.sirena.journey.models.JourneyTask;
import org.sirena.journey.models.UserJourney;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class JourneyTransform implements Transform<UserJourney> {

    private static final Logger logger = LoggerFactory.getLogger(JourneyTransform.class);

    private record OpenSection(String name, List<JourneyTask> tasks) {
    }

    private final boolean strictScores;
    private final List<OpenSection> sections = new ArrayList<>();
    private OpenSection current;
    private String title;
    private String accTitle;
    private String accDescription;

    /**
     * @param strictScores whether a score outside 1..5 fails the parse instead of being kept
     */
    public JourneyTransform(boolean strictScores) {
        this.strictScores = strictScores;
    }

    @Override
    public UserJourney apply(Captures tree) {
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("section")) {
                current = new OpenSection(stmt.text("section"), new ArrayList<>());
                sections.add(current);
            } else if (stmt.has("task")) {
                task(stmt);
            } else if (stmt.has("acc_title")) {
                accTitle = stmt.text("acc_title");
            } else if (stmt.has("acc_descr")) {
                accDescription = stmt.text("acc_descr");
            } else if (stmt.has("title")) {
                title = stmt.text("title");
            }
        }
        List<JourneySection> built = sections.stream()
                .map(section -> new JourneySection(section.name(), section.tasks()))
                .toList();
        return new UserJourney(title, built, accTitle, accDescription);
    }

    private void task(Captures stmt) {
        String name = stmt.text("task");
        int score = Integer.parseInt(stmt.text("score"));
        if (score < 1 || score > 5) {
            if (strictScores) {
                throw new CanonicalizationException(
                        String.format("Score for task '%s' must be between 1 and 5, got %d", name, score));
            }
            logger.warn("Task '{}' has out-of-range score {}", name, score);
        }
        List<String> actors = Arrays.stream(stmt.optText("actors").split(","))
                .map(String::trim)
                .filter(a -> !a.isEmpty())
                .toList();
        if (current == null) {
            current = new OpenSection("", new ArrayList<>());
            sections.add(current);
        }
        current.tasks().add(new JourneyTask(name, score, actors));
    }
}
