package org.sirena.mindmap.models;

import org.sirena.diagram.Diagram;

import java.util.List;
import java.util.stream.IntStream;

public record Mindmap(List<MindmapNode> nodes) implements Diagram {

    public Mindmap {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    @Override
    public String diagramType() {
        return "mindmap";
    }

    /** A mindmap is valid with exactly one root and parent indexes that point backwards. */
    @Override
    public boolean isValid() {
        long roots = nodes.stream().filter(n -> n.getParentIndex() < 0).count();
        boolean parentsResolve = IntStream.range(0, nodes.size())
                .allMatch(i -> nodes.get(i).getParentIndex() < i);
        return roots == 1 && parentsResolve;
    }

    /** The first root node, or null for an empty mindmap. */
    public MindmapNode root() {
        return nodes.stream().filter(n -> n.getParentIndex() < 0).findFirst().orElse(null);
    }

    public MindmapNode findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst().orElse(null);
    }

    public List<MindmapNode> childrenOf(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return List.of();
        }
        return nodes.stream().filter(n -> n.getParentIndex() == index).toList();
    }

    /** Deepest level in the tree; a lone root has depth 0. */
    public int depth() {
        return nodes.stream().mapToInt(MindmapNode::getLevel).max().orElse(0);
    }

    private int indexOf(String id) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getId().equals(id)) return i;
        }
        return -1;
    }
}
