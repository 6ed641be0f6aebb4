package org.sirena.pie;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.pie.models.PieChart;
import org.sirena.pie.models.PieSlice;

import java.util.ArrayList;
import java.util.List;

public class PieTransform implements Transform<PieChart> {

    @Override
    public PieChart apply(Captures tree) {
        String title = tree.has("title") ? tree.text("title") : null;
        String accTitle = null;
        String accDescription = null;
        List<PieSlice> slices = new ArrayList<>();
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("label")) {
                slices.add(new PieSlice(stmt.text("label"), Double.parseDouble(stmt.text("value"))));
            } else if (stmt.has("acc_title")) {
                accTitle = stmt.text("acc_title");
            } else if (stmt.has("acc_descr")) {
                accDescription = stmt.text("acc_descr");
            } else if (stmt.has("title")) {
                title = stmt.text("title");
            }
        }
        return new PieChart(title, tree.has("show_data"), slices, accTitle, accDescription);
    }
}
