package org.sirena.xychart;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.xychart.models.XyAxis;
import org.sirena.xychart.models.XyChart;
import org.sirena.xychart.models.XySeries;

import java.util.ArrayList;
import java.util.List;

public class XyChartTransform implements Transform<XyChart> {

    @Override
    public XyChart apply(Captures tree) {
        XyChart.XyChartBuilder chart = XyChart.builder()
                .orientation(tree.has("orientation") ? tree.text("orientation") : null);
        List<XySeries> series = new ArrayList<>();
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("axis")) {
                if (stmt.text("axis").equals("x")) {
                    chart.xAxis(axis(stmt));
                } else {
                    chart.yAxis(axis(stmt));
                }
            } else if (stmt.has("series")) {
                List<Double> values = stmt.texts("data", "value").stream().map(Double::valueOf).toList();
                series.add(new XySeries(stmt.text("series"),
                        stmt.has("series_name") ? stmt.text("series_name") : null, new ArrayList<>(values)));
            } else if (stmt.has("acc_title")) {
                chart.accTitle(stmt.text("acc_title"));
            } else if (stmt.has("acc_descr")) {
                chart.accDescription(stmt.text("acc_descr"));
            } else if (stmt.has("title")) {
                chart.title(unquote(stmt.text("title")));
            }
        }
        return chart.series(series).build();
    }

    private static XyAxis axis(Captures stmt) {
        return new XyAxis(
                stmt.has("axis_label") ? stmt.text("axis_label") : null,
                new ArrayList<>(stmt.texts("categories", "category")),
                stmt.has("min") ? Double.valueOf(stmt.text("min")) : null,
                stmt.has("max") ? Double.valueOf(stmt.text("max")) : null);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
