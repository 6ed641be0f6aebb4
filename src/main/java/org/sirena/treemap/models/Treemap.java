package org.sirena.treemap.models;

import org.sirena.diagram.Diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

public record Treemap(
        String title,
        List<TreemapNode> nodes,
        Map<String, String> classDefs,
        String accTitle,
        String accDescription
) implements Diagram {

    public Treemap {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        classDefs = classDefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classDefs));
    }

    @Override
    public String diagramType() {
        return "treemap";
    }

    /** Valid when there is a node and every leaf carries a value. */
    @Override
    public boolean isValid() {
        return !nodes.isEmpty()
                && IntStream.range(0, nodes.size())
                .filter(i -> childrenOf(i).isEmpty())
                .allMatch(i -> nodes.get(i).value() != null);
    }

    public List<TreemapNode> roots() {
        return nodes.stream().filter(TreemapNode::isRoot).toList();
    }

    public List<TreemapNode> childrenOf(int index) {
        return nodes.stream().filter(n -> n.parentIndex() == index).toList();
    }

    /** Value of the node at {@code index}: its own value, or the sum over its children. */
    public double valueOf(int index) {
        TreemapNode node = nodes.get(index);
        if (node.value() != null) {
            return node.value();
        }
        return IntStream.range(0, nodes.size())
                .filter(i -> nodes.get(i).parentIndex() == index)
                .mapToDouble(this::valueOf)
                .sum();
    }

    public double totalValue() {
        return IntStream.range(0, nodes.size())
                .filter(i -> nodes.get(i).isRoot())
                .mapToDouble(this::valueOf)
                .sum();
    }

    /** Deepest level in the tree; roots are at depth 0. */
    public int depth() {
        return nodes.stream().mapToInt(TreemapNode::level).max().orElse(0);
    }
}
