package org.sirena.flowchart;

import org.sirena.diagram.ContextStack;
import org.sirena.diagram.EntityRegistry;
import org.sirena.diagram.Transform;
import org.sirena.flowchart.models.ClickAction;
import org.sirena.flowchart.models.Flowchart;
import org.sirena.flowchart.models.FlowchartEdge;
import org.sirena.flowchart.models.FlowchartNode;
import org.sirena.flowchart.models.FlowchartSubgraph;
import org.sirena.grammar.CstNode.Captures;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class FlowchartTransform implements Transform<Flowchart> {

    private final String defaultDirection;

    private final EntityRegistry<FlowchartNode> nodes = new EntityRegistry<>(FlowchartNode::new);
    private final List<FlowchartEdge> edges = new ArrayList<>();
    private final List<SubgraphDraft> subgraphs = new ArrayList<>();
    private final ContextStack<SubgraphDraft> scope = new ContextStack<>();
    private final Map<String, String> classDefs = new LinkedHashMap<>();
    private final Map<String, String> styles = new LinkedHashMap<>();
    private final Map<Integer, String> linkStyles = new LinkedHashMap<>();
    private final List<ClickAction> clicks = new ArrayList<>();
    private String direction;
    private String accTitle;
    private String accDescription;

    public FlowchartTransform(String defaultDirection) {
        this.defaultDirection = defaultDirection;
    }

    @Override
    public Flowchart apply(Captures tree) {
        direction = tree.has("direction") ? tree.text("direction") : defaultDirection;
        tree.records("statements").forEach(this::statement);

        List<FlowchartSubgraph> builtSubgraphs = subgraphs.stream()
                .map(SubgraphDraft::build)
                .toList();
        return new Flowchart(direction, nodes.values(), edges, new ArrayList<>(builtSubgraphs),
                classDefs, styles, linkStyles, clicks, accTitle, accDescription);
    }

    private void statement(Captures stmt) {
        if (stmt.has("subgraph")) {
            subgraph(stmt);
        } else if (stmt.has("subgraph_direction")) {
            String dir = stmt.text("subgraph_direction");
            scope.current().ifPresentOrElse(s -> s.direction = dir, () -> direction = dir);
        } else if (stmt.has("style")) {
            styles.put(stmt.text("style"), stmt.text("css"));
        } else if (stmt.has("link_style")) {
            linkStyle(stmt.text("link_style"), stmt.text("css"));
        } else if (stmt.has("class_def")) {
            for (String name : splitIds(stmt.text("class_def"))) {
                classDefs.put(name, stmt.text("css"));
            }
        } else if (stmt.has("class_targets")) {
            for (String id : splitIds(stmt.text("class_targets"))) {
                touch(id).addClass(stmt.text("class_name"));
            }
        } else if (stmt.has("click")) {
            clicks.add(new ClickAction(stmt.text("click"),
                    stmt.has("href") ? stmt.text("href") : null,
                    stmt.has("callback") ? stmt.text("callback") : null,
                    stmt.has("tooltip") ? stmt.text("tooltip") : null,
                    stmt.has("target") ? stmt.text("target") : null));
        } else if (stmt.has("acc_title")) {
            accTitle = stmt.text("acc_title");
        } else if (stmt.has("acc_descr")) {
            accDescription = stmt.text("acc_descr");
        } else if (stmt.has("title")) {
            accTitle = accTitle == null ? stmt.text("title") : accTitle;
        } else if (stmt.has("first")) {
            chain(stmt);
        }
    }

    private void subgraph(Captures stmt) {
        String id = stmt.text("subgraph");
        String title = stripQuotes(stmt.optText("title"));
        SubgraphDraft draft = new SubgraphDraft(id, title.isEmpty() ? id : title,
                scope.current().map(s -> s.id).orElse(null));
        subgraphs.add(draft);
        scope.within(draft, () -> stmt.records("body").forEach(this::statement));
    }

    private void chain(Captures stmt) {
        String previous = nodeRef(stmt.record("first"));
        for (Captures step : stmt.records("links")) {
            Captures link = step.record("link");
            String next = nodeRef(step.record("node"));
            edges.add(new FlowchartEdge(previous, next,
                    stripQuotes(link.optText("label")), link.text("arrow_type")));
            previous = next;
        }
    }

    /** Registers or updates the referenced node and returns its id. */
    private String nodeRef(Captures ref) {
        String id = ref.text("id");
        boolean bare = !ref.has("shape") && !ref.has("class_ref");
        if (bare && !nodes.contains(id) && subgraphs.stream().anyMatch(s -> s.id.equals(id))) {
            return id;
        }
        FlowchartNode node = touch(id);
        if (ref.has("shape")) {
            node.setShape(ref.text("shape"));
            node.setLabel(EntityRegistry.merge(node.getLabel(), stripQuotes(ref.optText("label"))));
        }
        if (ref.has("class_ref")) {
            node.addClass(ref.text("class_ref"));
        }
        return id;
    }

    private FlowchartNode touch(String id) {
        FlowchartNode node = nodes.findOrCreate(id);
        scope.current().ifPresent(s -> s.nodeIds.add(id));
        return node;
    }

    private void linkStyle(String indices, String css) {
        if (indices.equals("default")) {
            linkStyles.put(-1, css);
            return;
        }
        for (String index : splitIds(indices)) {
            linkStyles.put(Integer.parseInt(index), css);
        }
    }

    private static List<String> splitIds(String text) {
        List<String> ids = new ArrayList<>();
        for (String part : text.split(",")) {
            String id = stripQuotes(part.trim());
            if (!id.isEmpty()) ids.add(id);
        }
        return ids;
    }

    static String stripQuotes(String text) {
        String s = text.trim();
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    private static class SubgraphDraft {
        final String id;
        final String title;
        final String parentId;
        final Set<String> nodeIds = new LinkedHashSet<>();
        String direction;

        SubgraphDraft(String id, String title, String parentId) {
            this.id = id;
            this.title = title;
            this.parentId = parentId;
        }

        FlowchartSubgraph build() {
            return new FlowchartSubgraph(id, title, direction, new ArrayList<>(nodeIds), parentId);
        }
    }
}
