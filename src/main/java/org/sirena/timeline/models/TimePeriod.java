package org.sirena.timeline.models;

import java.util.List;

/**
 * A point on the timeline and the events listed against it.
 */
public record TimePeriod(String time, List<String> events) {
    public TimePeriod {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
