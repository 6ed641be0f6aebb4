package org.sirena.gantt;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code gantt} documents. Task details are split at commas; their meaning
 * depends on position and is worked out by the transform.
 */
public class GanttGrammar extends Grammar {

    private static final Rule TASK_ID = match("[a-zA-Z0-9_\\-]").repeat(1).named("task id");

    private final Rule header = seq(keyword("gantt"), LINE_END);

    private final Rule settings = choice(
            setting("dateFormat", "date_format"),
            setting("axisFormat", "axis_format"),
            setting("tickInterval", "tick_interval"),
            setting("todayMarker", "today_marker"),
            setting("excludes", "excludes"),
            setting("includes", "includes"),
            setting("weekday", "weekday"),
            seq(keyword("inclusiveEndDates"), constant("inclusive_end_dates", "true"), LINE_END));

    private final Rule section = seq(keyword("section"), SPACES, REST_OF_LINE.as("section"), LINE_END);

    private final Rule click = seq(
            keyword("click"), SPACES, TASK_ID.as("click"), SPACES,
            choice(seq(keyword("href"), SPACES, QUOTED.as("href")),
                    seq(keyword("call"), SPACES, REST_OF_LINE.as("callback"))),
            LINE_END);

    private final Rule detail = anyUntil(choice(COMMA, LINE_END)).as("detail");

    private final Rule task = seq(
            anyUntil(choice(COLON, NEWLINE)).as("task"), COLON, OPT_SPACES,
            seq(detail, seq(OPT_SPACES, COMMA, OPT_SPACES, detail).repeat(0)).as("details"),
            LINE_END);

    private final Rule root = document(header, choice(settings, section, click, METADATA, task));

    private static Rule setting(String keyword, String name) {
        return seq(keyword(keyword), SPACES, REST_OF_LINE.as(name), LINE_END);
    }

    @Override
    protected Rule root() {
        return root;
    }
}
