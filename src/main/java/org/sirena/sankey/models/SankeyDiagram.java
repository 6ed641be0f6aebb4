package org.sirena.sankey.models;

import org.sirena.diagram.Diagram;

import java.util.List;

public record SankeyDiagram(
        List<SankeyNode> nodes,
        List<SankeyFlow> flows,
        String title,
        String accTitle,
        String accDescription
) implements Diagram {

    public SankeyDiagram {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        flows = flows == null ? List.of() : List.copyOf(flows);
    }

    @Override
    public String diagramType() {
        return "sankey";
    }

    @Override
    public boolean isValid() {
        return !flows.isEmpty() && flows.stream().allMatch(f ->
                f.value() >= 0 && findNode(f.sourceId()) != null && findNode(f.targetId()) != null);
    }

    public SankeyNode findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst().orElse(null);
    }

    public List<SankeyFlow> flowsFrom(String id) {
        return flows.stream().filter(f -> f.sourceId().equals(id)).toList();
    }

    public List<SankeyFlow> flowsTo(String id) {
        return flows.stream().filter(f -> f.targetId().equals(id)).toList();
    }

    public double totalInflow(String id) {
        return flowsTo(id).stream().mapToDouble(SankeyFlow::value).sum();
    }

    public double totalOutflow(String id) {
        return flowsFrom(id).stream().mapToDouble(SankeyFlow::value).sum();
    }

    /** Nodes with outgoing flows only. */
    public List<SankeyNode> sourceNodes() {
        return nodes.stream().filter(n -> flowsTo(n.id()).isEmpty() && !flowsFrom(n.id()).isEmpty()).toList();
    }

    /** Nodes with incoming flows only. */
    public List<SankeyNode> sinkNodes() {
        return nodes.stream().filter(n -> flowsFrom(n.id()).isEmpty() && !flowsTo(n.id()).isEmpty()).toList();
    }
}
