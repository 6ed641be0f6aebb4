package org.sirena.xychart.models;

import lombok.Builder;
import org.sirena.diagram.Diagram;

import java.util.List;

@Builder
public record XyChart(
        String title,
        String orientation,
        XyAxis xAxis,
        XyAxis yAxis,
        List<XySeries> series,
        String accTitle,
        String accDescription
) implements Diagram {

    public XyChart {
        orientation = orientation == null ? "vertical" : orientation;
        series = series == null ? List.of() : List.copyOf(series);
    }

    @Override
    public String diagramType() {
        return "xychart";
    }

    /** Valid when there is data and, on a categorical x-axis, each series has one value per category. */
    @Override
    public boolean isValid() {
        if (series.isEmpty()) {
            return false;
        }
        if (xAxis == null || !xAxis.isCategorical()) {
            return true;
        }
        int expected = xAxis.categories().size();
        return series.stream().allMatch(s -> s.values().size() == expected);
    }

    public XySeries findSeries(String name) {
        return series.stream().filter(s -> name.equals(s.name())).findFirst().orElse(null);
    }

    public List<XySeries> seriesOfType(String type) {
        return series.stream().filter(s -> s.type().equals(type)).toList();
    }

    public double minValue() {
        return series.stream().flatMap(s -> s.values().stream()).mapToDouble(Double::doubleValue).min().orElse(0);
    }

    public double maxValue() {
        return series.stream().flatMap(s -> s.values().stream()).mapToDouble(Double::doubleValue).max().orElse(0);
    }
}
