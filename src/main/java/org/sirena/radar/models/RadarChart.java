package org.sirena.radar.models;

import lombok.Builder;
import org.sirena.diagram.Diagram;

import java.util.List;

@Builder
public record RadarChart(
        String title,
        List<RadarAxis> axes,
        List<RadarCurve> curves,
        Integer ticks,
        Boolean showLegend,
        String graticule,
        Double min,
        Double max,
        String accTitle,
        String accDescription
) implements Diagram {

    public RadarChart {
        axes = axes == null ? List.of() : List.copyOf(axes);
        curves = curves == null ? List.of() : List.copyOf(curves);
    }

    @Override
    public String diagramType() {
        return "radar";
    }

    /** Valid when there are axes and every curve value belongs to a declared axis. */
    @Override
    public boolean isValid() {
        return !axes.isEmpty() && curves.stream()
                .allMatch(c -> c.values().keySet().stream().allMatch(a -> findAxis(a) != null));
    }

    public RadarAxis findAxis(String id) {
        return axes.stream().filter(a -> a.id().equals(id)).findFirst().orElse(null);
    }

    public RadarCurve findCurve(String id) {
        return curves.stream().filter(c -> c.id().equals(id)).findFirst().orElse(null);
    }

    public Double valueOf(String curveId, String axisId) {
        RadarCurve curve = findCurve(curveId);
        return curve == null ? null : curve.values().get(axisId);
    }

    /** Largest value over all curves; 0 when there are none. */
    public double maxValue() {
        return curves.stream()
                .flatMap(c -> c.values().values().stream())
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0);
    }
}
