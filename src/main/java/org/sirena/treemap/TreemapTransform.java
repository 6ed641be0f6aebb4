package org.sirena.treemap;

import org.sirena.diagram.IndentationTree;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.treemap.models.Treemap;
import org.sirena.treemap.models.TreemapNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TreemapTransform implements Transform<Treemap> {

    @Override
    public Treemap apply(Captures tree) {
        List<Captures> nodeLines = new ArrayList<>();
        Map<String, String> classDefs = new LinkedHashMap<>();
        String title = null;
        String accTitle = null;
        String accDescription = null;
        for (Captures line : tree.records("statements")) {
            if (line.has("label")) {
                nodeLines.add(line);
            } else if (line.has("class_def")) {
                classDefs.put(line.text("class_def"), line.text("css"));
            } else if (line.has("acc_title")) {
                accTitle = line.text("acc_title");
            } else if (line.has("acc_descr")) {
                accDescription = line.text("acc_descr");
            } else if (line.has("title")) {
                title = line.text("title");
            }
        }

        IndentationTree.Layout layout = IndentationTree.build(
                nodeLines.stream().map(l -> l.rawText("indent").length()).toList());
        List<TreemapNode> nodes = new ArrayList<>();
        for (int i = 0; i < nodeLines.size(); i++) {
            Captures line = nodeLines.get(i);
            nodes.add(new TreemapNode(
                    line.text("label"),
                    line.has("value") ? Double.valueOf(line.text("value")) : null,
                    line.has("class_name") ? line.text("class_name") : null,
                    layout.level(i),
                    layout.parent(i)));
        }
        return new Treemap(title, nodes, classDefs, accTitle, accDescription);
    }
}
