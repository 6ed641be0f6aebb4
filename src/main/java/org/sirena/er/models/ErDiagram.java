package org.sirena.er.models;

import org.sirena.diagram.Diagram;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record ErDiagram(
        List<ErEntity> entities,
        List<ErRelationship> relationships,
        String title,
        String accTitle,
        String accDescription
) implements Diagram {

    public ErDiagram {
        entities = entities == null ? List.of() : List.copyOf(entities);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    @Override
    public String diagramType() {
        return "er";
    }

    /** Valid when there is an entity, every relationship endpoint exists and attributes are named. */
    @Override
    public boolean isValid() {
        if (entities.isEmpty()) {
            return false;
        }
        Set<String> ids = new HashSet<>();
        entities.forEach(e -> ids.add(e.getId()));
        return relationships.stream().allMatch(r -> ids.contains(r.fromId()) && ids.contains(r.toId()))
                && entities.stream().flatMap(e -> e.getAttributes().stream()).noneMatch(a -> a.name().isBlank());
    }

    public ErEntity findEntity(String id) {
        return entities.stream().filter(e -> e.getId().equals(id)).findFirst().orElse(null);
    }

    public List<ErRelationship> relationshipsFrom(String entityId) {
        return relationships.stream().filter(r -> r.fromId().equals(entityId)).toList();
    }

    public List<ErRelationship> relationshipsTo(String entityId) {
        return relationships.stream().filter(r -> r.toId().equals(entityId)).toList();
    }

    public List<ErRelationship> identifyingRelationships() {
        return relationships.stream().filter(ErRelationship::isIdentifying).toList();
    }

    public List<ErRelationship> nonIdentifyingRelationships() {
        return relationships.stream().filter(r -> !r.isIdentifying()).toList();
    }
}
