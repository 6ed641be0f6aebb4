package org.sirena.classdiagram.models;

import org.sirena.diagram.Diagram;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record ClassDiagram(
        String direction,
        List<ClassEntity> classes,
        List<ClassRelationship> relationships,
        List<ClassNamespace> namespaces,
        List<ClassInteraction> interactions,
        List<ClassNote> notes,
        Map<String, String> classDefs,
        String title,
        String accTitle,
        String accDescription
) implements Diagram {

    public ClassDiagram {
        classes = classes == null ? List.of() : List.copyOf(classes);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
        notes = notes == null ? List.of() : List.copyOf(notes);
        classDefs = classDefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classDefs));
    }

    @Override
    public String diagramType() {
        return "class";
    }

    /**
     * Valid when every relationship, namespace member and note target names a known class.
     */
    @Override
    public boolean isValid() {
        Set<String> ids = new HashSet<>();
        classes.forEach(c -> ids.add(c.getId()));
        return relationships.stream().allMatch(r -> ids.contains(r.sourceId()) && ids.contains(r.targetId()))
                && namespaces.stream().allMatch(n -> ids.containsAll(n.classIds()))
                && notes.stream().allMatch(n -> n.classId() == null || ids.contains(n.classId()));
    }

    public ClassEntity findClass(String id) {
        return classes.stream().filter(c -> c.getId().equals(id)).findFirst().orElse(null);
    }

    public List<ClassRelationship> relationshipsFrom(String classId) {
        return relationships.stream().filter(r -> r.sourceId().equals(classId)).toList();
    }

    public List<ClassRelationship> relationshipsTo(String classId) {
        return relationships.stream().filter(r -> r.targetId().equals(classId)).toList();
    }

    /** Ids of the classes the given class inherits from. */
    public List<String> parents(String classId) {
        return relationships.stream()
                .filter(r -> r.type().equals("inheritance") && r.sourceId().equals(classId))
                .map(ClassRelationship::targetId)
                .toList();
    }

    /** Ids of the classes inheriting from the given class. */
    public List<String> children(String classId) {
        return relationships.stream()
                .filter(r -> r.type().equals("inheritance") && r.targetId().equals(classId))
                .map(ClassRelationship::sourceId)
                .toList();
    }
}
