package org.sirena.flowchart.models;

import org.sirena.diagram.Diagram;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record Flowchart(
        String direction,
        List<FlowchartNode> nodes,
        List<FlowchartEdge> edges,
        List<FlowchartSubgraph> subgraphs,
        Map<String, String> classDefs,
        Map<String, String> styles,
        Map<Integer, String> linkStyles,
        List<ClickAction> clicks,
        String accTitle,
        String accDescription
) implements Diagram {

    public Flowchart {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        subgraphs = subgraphs == null ? List.of() : List.copyOf(subgraphs);
        classDefs = classDefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classDefs));
        styles = styles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(styles));
        linkStyles = linkStyles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(linkStyles));
        clicks = clicks == null ? List.of() : List.copyOf(clicks);
    }

    @Override
    public String diagramType() {
        return "flowchart";
    }

    /**
     * A flowchart is valid when it has at least one node and every edge endpoint is a
     * known node or subgraph.
     */
    @Override
    public boolean isValid() {
        if (nodes.isEmpty()) {
            return false;
        }
        Set<String> known = new HashSet<>();
        nodes.forEach(n -> known.add(n.getId()));
        subgraphs.forEach(s -> known.add(s.id()));
        return edges.stream().allMatch(e -> known.contains(e.sourceId()) && known.contains(e.targetId()));
    }

    /** @return the node with the given id, or null if there is none */
    public FlowchartNode findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst().orElse(null);
    }

    /** @return the subgraph with the given id, or null if there is none */
    public FlowchartSubgraph findSubgraph(String id) {
        return subgraphs.stream().filter(s -> s.id().equals(id)).findFirst().orElse(null);
    }

    public List<FlowchartEdge> edgesFrom(String nodeId) {
        return edges.stream().filter(e -> e.sourceId().equals(nodeId)).toList();
    }

    public List<FlowchartEdge> edgesTo(String nodeId) {
        return edges.stream().filter(e -> e.targetId().equals(nodeId)).toList();
    }
}
