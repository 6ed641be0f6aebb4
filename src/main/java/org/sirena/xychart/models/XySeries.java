package org.sirena.xychart.models;

import java.util.List;

/**
 * @param type line, bar or dataset
 */
public record XySeries(String type, String name, List<Double> values) {

    public XySeries {
        values = values == null ? List.of() : List.copyOf(values);
    }
}
