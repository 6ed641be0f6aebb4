package org.sirena.c4.models;

import lombok.Builder;
import org.sirena.diagram.Diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param c4Type       header keyword, e.g. {@code C4Context}
 * @param layoutConfig settings from {@code UpdateLayoutConfig}, without the {@code $} prefix
 */
@Builder
public record C4Diagram(
        String c4Type,
        String title,
        List<C4Element> elements,
        List<C4Boundary> boundaries,
        List<C4Relationship> relationships,
        Map<String, String> layoutConfig,
        String accTitle,
        String accDescription
) implements Diagram {

    public C4Diagram {
        elements = elements == null ? List.of() : List.copyOf(elements);
        boundaries = boundaries == null ? List.of() : List.copyOf(boundaries);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        layoutConfig = layoutConfig == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(layoutConfig));
    }

    @Override
    public String diagramType() {
        return "c4";
    }

    /** Valid when relationship endpoints and boundary references all resolve. */
    @Override
    public boolean isValid() {
        boolean relationsResolve = relationships.stream()
                .allMatch(r -> isNode(r.fromId()) && isNode(r.toId()));
        boolean elementsPlaced = elements.stream()
                .allMatch(e -> e.boundaryId() == null || findBoundary(e.boundaryId()) != null);
        boolean boundariesNested = boundaries.stream()
                .allMatch(b -> b.parentId() == null || findBoundary(b.parentId()) != null);
        return relationsResolve && elementsPlaced && boundariesNested;
    }

    private boolean isNode(String id) {
        return findElement(id) != null || findBoundary(id) != null;
    }

    public C4Element findElement(String id) {
        return elements.stream().filter(e -> e.id().equals(id)).findFirst().orElse(null);
    }

    public C4Boundary findBoundary(String id) {
        return boundaries.stream().filter(b -> b.id().equals(id)).findFirst().orElse(null);
    }

    public List<C4Relationship> relationshipsFrom(String id) {
        return relationships.stream().filter(r -> r.fromId().equals(id)).toList();
    }

    public List<C4Relationship> relationshipsTo(String id) {
        return relationships.stream().filter(r -> r.toId().equals(id)).toList();
    }

    /** Elements declared directly inside the boundary. */
    public List<C4Element> elementsInBoundary(String boundaryId) {
        return elements.stream().filter(e -> boundaryId.equals(e.boundaryId())).toList();
    }
}
