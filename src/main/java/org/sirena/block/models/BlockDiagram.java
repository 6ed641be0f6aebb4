package org.sirena.block.models;

import org.sirena.diagram.Diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param columns top-level column count; null when the layout picks it
 */
public record BlockDiagram(
        Integer columns,
        List<Block> blocks,
        List<BlockEdge> edges,
        Map<String, String> classDefs,
        String accTitle,
        String accDescription
) implements Diagram {

    public BlockDiagram {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        edges = edges == null ? List.of() : List.copyOf(edges);
        classDefs = classDefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classDefs));
    }

    @Override
    public String diagramType() {
        return "block";
    }

    @Override
    public boolean isValid() {
        boolean edgesResolve = edges.stream()
                .allMatch(e -> findBlock(e.fromId()) != null && findBlock(e.toId()) != null);
        boolean parentsResolve = blocks.stream()
                .allMatch(b -> b.getParentId() == null || findBlock(b.getParentId()) != null);
        return edgesResolve && parentsResolve;
    }

    public Block findBlock(String id) {
        return blocks.stream().filter(b -> b.getId().equals(id)).findFirst().orElse(null);
    }

    public List<Block> topLevel() {
        return blocks.stream().filter(b -> b.getParentId() == null).toList();
    }

    public List<Block> childrenOf(String id) {
        Block parent = findBlock(id);
        if (parent == null) {
            return List.of();
        }
        return parent.getChildIds().stream().map(this::findBlock).toList();
    }

    public List<BlockEdge> edgesFrom(String id) {
        return edges.stream().filter(e -> e.fromId().equals(id)).toList();
    }

    public List<BlockEdge> edgesTo(String id) {
        return edges.stream().filter(e -> e.toId().equals(id)).toList();
    }
}
