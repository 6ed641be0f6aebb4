package org.sirena.timeline;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code timeline} documents: {@code time : event : event}, with lines that
 * start with a colon continuing the previous period.
 */
public class TimelineGrammar extends Grammar {

    private final Rule header = seq(keyword("timeline"), seq(SPACES, anyUntil(LINE_END)).maybe(), LINE_END);

    private final Rule section = seq(keyword("section"), SPACES, REST_OF_LINE.as("section"), LINE_END);

    private final Rule event = seq(OPT_SPACES, COLON, OPT_SPACES, anyUntil0(choice(COLON, LINE_END)).as("event"));

    private final Rule continuation = seq(constant("continuation", "true"), event.repeat(1).as("events"), LINE_END);

    private final Rule period = seq(
            anyUntil(choice(COLON, LINE_END)).as("period"),
            event.repeat(0).as("events"),
            LINE_END);

    private final Rule root = document(header, choice(METADATA, section, continuation, period));

    @Override
    protected Rule root() {
        return root;
    }
}
