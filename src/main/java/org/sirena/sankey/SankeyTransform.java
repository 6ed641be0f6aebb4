package org.sirena.sankey;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.sankey.models.SankeyDiagram;
import org.sirena.sankey.models.SankeyFlow;
import org.sirena.sankey.models.SankeyNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SankeyTransform implements Transform<SankeyDiagram> {

    private final Map<String, SankeyNode> nodes = new LinkedHashMap<>();

    @Override
    public SankeyDiagram apply(Captures tree) {
        List<SankeyFlow> flows = new ArrayList<>();
        String title = null;
        String accTitle = null;
        String accDescription = null;
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("source")) {
                String source = field(stmt, "source");
                String target = field(stmt, "target");
                nodes.putIfAbsent(source, new SankeyNode(source, source));
                nodes.putIfAbsent(target, new SankeyNode(target, target));
                flows.add(new SankeyFlow(source, target, Double.parseDouble(stmt.text("value"))));
            } else if (stmt.has("node")) {
                String id = stmt.text("node");
                nodes.put(id, new SankeyNode(id, stmt.text("node_label")));
            } else if (stmt.has("acc_title")) {
                accTitle = stmt.text("acc_title");
            } else if (stmt.has("acc_descr")) {
                accDescription = stmt.text("acc_descr");
            } else if (stmt.has("title")) {
                title = stmt.text("title");
            }
        }
        return new SankeyDiagram(new ArrayList<>(nodes.values()), flows, title, accTitle, accDescription);
    }

    private static String field(Captures stmt, String name) {
        return stmt.text(name).replace("\"\"", "\"");
    }
}
