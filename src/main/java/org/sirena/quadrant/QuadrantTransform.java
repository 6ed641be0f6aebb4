package org.sirena.quadrant;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.quadrant.models.QuadrantChart;
import org.sirena.quadrant.models.QuadrantPoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class QuadrantTransform implements Transform<QuadrantChart> {

    @Override
    public QuadrantChart apply(Captures tree) {
        QuadrantChart.QuadrantChartBuilder chart = QuadrantChart.builder();
        Map<Integer, String> quadrants = new LinkedHashMap<>();
        Map<String, String> classDefs = new LinkedHashMap<>();
        List<QuadrantPoint> points = new ArrayList<>();
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("x_left")) {
                chart.xAxisLeft(stmt.text("x_left")).xAxisRight(stmt.has("x_right") ? stmt.text("x_right") : null);
            } else if (stmt.has("y_bottom")) {
                chart.yAxisBottom(stmt.text("y_bottom")).yAxisTop(stmt.has("y_top") ? stmt.text("y_top") : null);
            } else if (stmt.has("quadrant")) {
                quadrants.put(Integer.parseInt(stmt.text("quadrant")), stmt.text("quadrant_label"));
            } else if (stmt.has("class_def")) {
                classDefs.put(stmt.text("class_def"), stmt.text("css"));
            } else if (stmt.has("point")) {
                points.add(point(stmt));
            } else if (stmt.has("acc_title")) {
                chart.accTitle(stmt.text("acc_title"));
            } else if (stmt.has("acc_descr")) {
                chart.accDescription(stmt.text("acc_descr"));
            } else if (stmt.has("title")) {
                chart.title(stmt.text("title"));
            }
        }
        return chart.quadrantLabels(quadrants).classDefs(classDefs).points(points).build();
    }

    private static QuadrantPoint point(Captures stmt) {
        QuadrantPoint.QuadrantPointBuilder point = QuadrantPoint.builder()
                .label(stmt.text("point"))
                .x(Double.parseDouble(stmt.text("x")))
                .y(Double.parseDouble(stmt.text("y")))
                .className(stmt.has("class_name") ? stmt.text("class_name") : null);
        for (Captures style : stmt.records("styles")) {
            if (style.has("radius")) point.radius(Double.parseDouble(style.text("radius")));
            if (style.has("color")) point.color(style.text("color"));
            if (style.has("stroke-color")) point.strokeColor(style.text("stroke-color"));
            if (style.has("stroke-width")) point.strokeWidth(style.text("stroke-width"));
        }
        return point.build();
    }
}
