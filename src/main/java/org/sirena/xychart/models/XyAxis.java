package org.sirena.xychart.models;

import java.util.List;

/**
 * Either categorical (non-empty {@code categories}) or numeric ({@code min}/{@code max}).
 */
public record XyAxis(String label, List<String> categories, Double min, Double max) {

    public XyAxis {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public boolean isCategorical() {
        return !categories.isEmpty();
    }
}
