package org.sirena.journey;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.journey.models.JourneySection;
import org.sirena.journey.models.JourneyTask;
import org.sirena.journey.models.UserJourney;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JourneyTest {

    private static final String OUT_OF_RANGE = """
            journey
            section Checkout
              Pay: 7: Me
            """;

    private final DiagramParser<UserJourney> strict =
            new DiagramParser<>("journey", new JourneyGrammar(), () -> new JourneyTransform(true));
    private final DiagramParser<UserJourney> lenient =
            new DiagramParser<>("journey", new JourneyGrammar(), () -> new JourneyTransform(false));

    @Test
    void shouldGroupTasksIntoSections() {
        UserJourney journey = strict.parse("""
                journey
                title My working day
                  Wake up: 2: Me
                section Go to work
                  Make tea: 5: Me
                  Go upstairs: 3: Me, Cat
                """);

        assertEquals("My working day", journey.title());
        assertEquals(List.of("", "Go to work"), journey.sections().stream().map(JourneySection::name).toList());
        assertEquals(new JourneyTask("Go upstairs", 3, List.of("Me", "Cat")), journey.sections().get(1).tasks().get(1));
        assertEquals(List.of("Me", "Cat"), journey.allActors());
        assertEquals(1, journey.tasksByActor("Cat").size());
        assertEquals(1, journey.tasksByScore(5).size());
        assertTrue(journey.isValid());
    }

    @Test
    void shouldRejectOutOfRangeScoreWhenStrict() {
        CanonicalizationException e = assertThrows(CanonicalizationException.class, () -> strict.parse(OUT_OF_RANGE));
        assertTrue(e.getMessage().contains("Pay"));
    }

    @Test
    void shouldKeepOutOfRangeScoreWhenLenient() {
        UserJourney journey = lenient.parse(OUT_OF_RANGE);

        assertEquals(7, journey.allTasks().get(0).score());
        assertFalse(journey.isValid());
    }

    @Test
    void shouldAllowTaskWithoutActors() {
        UserJourney journey = strict.parse("journey\nsection S\n  Rest: 4\n");

        assertTrue(journey.allTasks().get(0).actors().isEmpty());
    }
}
