package org.sirena.quadrant.models;

import lombok.Builder;
import org.sirena.diagram.Diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Builder
public record QuadrantChart(
        String title,
        String xAxisLeft,
        String xAxisRight,
        String yAxisBottom,
        String yAxisTop,
        Map<Integer, String> quadrantLabels,
        List<QuadrantPoint> points,
        Map<String, String> classDefs,
        String accTitle,
        String accDescription
) implements Diagram {

    public QuadrantChart {
        quadrantLabels = quadrantLabels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(quadrantLabels));
        points = points == null ? List.of() : List.copyOf(points);
        classDefs = classDefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classDefs));
    }

    @Override
    public String diagramType() {
        return "quadrant";
    }

    /** Valid when every point lies inside the unit square and names a defined class, if any. */
    @Override
    public boolean isValid() {
        return points.stream().allMatch(p ->
                p.x() >= 0 && p.x() <= 1 && p.y() >= 0 && p.y() <= 1
                        && (p.className() == null || classDefs.containsKey(p.className())));
    }

    public List<QuadrantPoint> pointsInQuadrant(int quadrant) {
        return points.stream().filter(p -> p.quadrant() == quadrant).toList();
    }

    public QuadrantPoint findPoint(String label) {
        return points.stream().filter(p -> p.label().equals(label)).findFirst().orElse(null);
    }
}
