package org.sirena.radar;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.radar.models.RadarAxis;
import org.sirena.radar.models.RadarChart;
import org.sirena.radar.models.RadarCurve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RadarTransform implements Transform<RadarChart> {

    private final List<RadarAxis> axes = new ArrayList<>();
    private final List<RadarCurve> curves = new ArrayList<>();

    @Override
    public RadarChart apply(Captures tree) {
        RadarChart.RadarChartBuilder chart = RadarChart.builder();
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("axes")) {
                for (Captures axis : stmt.records("axes")) {
                    String id = axis.text("id");
                    axes.add(new RadarAxis(id, axis.has("label") ? axis.text("label") : id));
                }
            } else if (stmt.has("curves")) {
                stmt.records("curves").forEach(c -> curves.add(curve(c)));
            } else if (stmt.has("option")) {
                option(chart, stmt.text("option"), stmt.text("option_value"));
            } else if (stmt.has("acc_title")) {
                chart.accTitle(stmt.text("acc_title"));
            } else if (stmt.has("acc_descr")) {
                chart.accDescription(stmt.text("acc_descr"));
            } else if (stmt.has("title")) {
                chart.title(stmt.text("title"));
            }
        }
        return chart.axes(axes).curves(curves).build();
    }

    private RadarCurve curve(Captures def) {
        String id = def.text("id");
        Map<String, Double> values = new LinkedHashMap<>();
        int position = 0;
        for (Captures entry : def.records("values")) {
            double value = Double.parseDouble(entry.text("value"));
            if (entry.has("axis")) {
                values.put(entry.text("axis"), value);
                continue;
            }
            // positional values map to axes declared so far, by index
            if (position >= axes.size()) {
                throw new CanonicalizationException(String.format(
                        "Curve '%s' has more values than the %d declared axes", id, axes.size()));
            }
            values.put(axes.get(position++).id(), value);
        }
        return new RadarCurve(id, def.has("label") ? def.text("label") : id, values);
    }

    private static void option(RadarChart.RadarChartBuilder chart, String name, String value) {
        switch (name) {
            case "ticks" -> chart.ticks(Integer.parseInt(value));
            case "showLegend" -> chart.showLegend(Boolean.parseBoolean(value));
            case "graticule" -> chart.graticule(value);
            case "min" -> chart.min(Double.parseDouble(value));
            case "max" -> chart.max(Double.parseDouble(value));
            default -> throw new CanonicalizationException("Unknown radar option: " + name);
        }
    }
}
