package org.sirena.timeline.models;

import java.util.List;

public record TimelineSection(String name, List<TimePeriod> periods) {
    public TimelineSection {
        periods = periods == null ? List.of() : List.copyOf(periods);
    }
}
