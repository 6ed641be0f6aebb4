package org.sirena.architecture;

import org.sirena.architecture.models.ArchitectureDiagram;
import org.sirena.architecture.models.ArchitectureEdge;
import org.sirena.architecture.models.ArchitectureGroup;
import org.sirena.architecture.models.ArchitectureService;
import org.sirena.diagram.EntityRegistry;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ArchitectureTransform implements Transform<ArchitectureDiagram> {

    private final Map<String, ArchitectureGroup> groups = new LinkedHashMap<>();
    private final Map<String, ArchitectureService> services = new LinkedHashMap<>();
    private final List<ArchitectureEdge> edges = new ArrayList<>();

    @Override
    public ArchitectureDiagram apply(Captures tree) {
        String title = null;
        String accTitle = null;
        String accDescription = null;
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("group")) {
                group(stmt);
            } else if (stmt.has("service")) {
                service(stmt.text("service"), stmt, false);
            } else if (stmt.has("junction")) {
                service(stmt.text("junction"), stmt, true);
            } else if (stmt.has("arrow_type")) {
                edges.add(edge(stmt));
            } else if (stmt.has("acc_title")) {
                accTitle = stmt.text("acc_title");
            } else if (stmt.has("acc_descr")) {
                accDescription = stmt.text("acc_descr");
            } else if (stmt.has("title")) {
                title = stmt.text("title");
            }
        }
        return new ArchitectureDiagram(title, new ArrayList<>(groups.values()),
                new ArrayList<>(services.values()), edges, accTitle, accDescription);
    }

    private void group(Captures stmt) {
        String id = stmt.text("group");
        ArchitectureGroup previous = groups.get(id);
        groups.put(id, new ArchitectureGroup(id,
                EntityRegistry.merge(previous == null ? null : previous.icon(), stmt.optText("icon")),
                EntityRegistry.merge(previous == null ? id : previous.label(), stmt.optText("label")),
                EntityRegistry.merge(previous == null ? null : previous.parentId(), stmt.optText("in"))));
    }

    private void service(String id, Captures stmt, boolean junction) {
        ArchitectureService previous = services.get(id);
        services.put(id, new ArchitectureService(id,
                EntityRegistry.merge(previous == null ? null : previous.icon(), stmt.optText("icon")),
                EntityRegistry.merge(previous == null ? id : previous.label(), stmt.optText("label")),
                EntityRegistry.merge(previous == null ? null : previous.groupId(), stmt.optText("in")),
                junction));
    }

    private static ArchitectureEdge edge(Captures stmt) {
        String arrow = stmt.text("arrow_type");
        return ArchitectureEdge.builder()
                .fromId(stmt.text("from"))
                .fromSide(stmt.has("from_side") ? stmt.text("from_side") : null)
                .fromArrow(arrow.equals("both") || arrow.equals("backward"))
                .toId(stmt.text("to"))
                .toSide(stmt.has("to_side") ? stmt.text("to_side") : null)
                .toArrow(arrow.equals("both") || arrow.equals("forward"))
                .label(stmt.has("edge_label") ? stmt.text("edge_label") : null)
                .build();
    }
}
