package org.sirena.requirement.models;

import org.sirena.diagram.Diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RequirementDiagram(
        String direction,
        List<Requirement> requirements,
        List<RequirementElement> elements,
        List<RequirementRelation> relations,
        Map<String, String> classDefs,
        String accTitle,
        String accDescription
) implements Diagram {

    public RequirementDiagram {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        elements = elements == null ? List.of() : List.copyOf(elements);
        relations = relations == null ? List.of() : List.copyOf(relations);
        classDefs = classDefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classDefs));
    }

    @Override
    public String diagramType() {
        return "requirement";
    }

    /** Valid when every relation endpoint is a declared requirement or element. */
    @Override
    public boolean isValid() {
        return relations.stream().allMatch(r -> isDeclared(r.sourceId()) && isDeclared(r.targetId()));
    }

    public boolean isDeclared(String name) {
        return findRequirement(name) != null || findElement(name) != null;
    }

    public Requirement findRequirement(String name) {
        return requirements.stream().filter(r -> r.getName().equals(name)).findFirst().orElse(null);
    }

    public RequirementElement findElement(String name) {
        return elements.stream().filter(e -> e.getName().equals(name)).findFirst().orElse(null);
    }

    public List<RequirementRelation> relationsFrom(String name) {
        return relations.stream().filter(r -> r.sourceId().equals(name)).toList();
    }

    public List<RequirementRelation> relationsTo(String name) {
        return relations.stream().filter(r -> r.targetId().equals(name)).toList();
    }
}
