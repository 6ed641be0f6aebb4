package org.sirena.timeline;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.timeline.models.TimePeriod;
import org.sirena.timeline.models.Timeline;
import org.sirena.timeline.models.TimelineSection;

import java.util.ArrayList;
import java.util.List;

public class TimelineTransform implements Transform<Timeline> {

    private record OpenPeriod(String name, List<String> events) {
        TimePeriod build() {
            return new TimePeriod(name, events);
        }
    }

    private record OpenSection(String name, List<OpenPeriod> periods) {
        TimelineSection build() {
            return new TimelineSection(name, periods.stream().map(OpenPeriod::build).toList());
        }
    }

    private final List<OpenPeriod> periods = new ArrayList<>();
    private final List<OpenSection> sections = new ArrayList<>();
    private OpenSection currentSection;
    private OpenPeriod lastPeriod;
    private String title;
    private String accTitle;
    private String accDescription;

    @Override
    public Timeline apply(Captures tree) {
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("section")) {
                currentSection = new OpenSection(stmt.text("section"), new ArrayList<>());
                sections.add(currentSection);
            } else if (stmt.has("continuation")) {
                if (lastPeriod == null) {
                    throw new CanonicalizationException("Event continuation before any time period");
                }
                lastPeriod.events().addAll(events(stmt));
            } else if (stmt.has("period")) {
                lastPeriod = new OpenPeriod(stmt.text("period"), new ArrayList<>(events(stmt)));
                (currentSection == null ? periods : currentSection.periods()).add(lastPeriod);
            } else if (stmt.has("acc_title")) {
                accTitle = stmt.text("acc_title");
            } else if (stmt.has("acc_descr")) {
                accDescription = stmt.text("acc_descr");
            } else if (stmt.has("title")) {
                title = stmt.text("title");
            }
        }
        return new Timeline(title,
                periods.stream().map(OpenPeriod::build).toList(),
                sections.stream().map(OpenSection::build).toList(),
                accTitle, accDescription);
    }

    private static List<String> events(Captures stmt) {
        return stmt.texts("events", "event").stream().filter(e -> !e.isEmpty()).toList();
    }
}
