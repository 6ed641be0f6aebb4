package org.sirena.architecture.models;

import org.sirena.diagram.Diagram;

import java.util.List;

public record ArchitectureDiagram(
        String title,
        List<ArchitectureGroup> groups,
        List<ArchitectureService> services,
        List<ArchitectureEdge> edges,
        String accTitle,
        String accDescription
) implements Diagram {

    public ArchitectureDiagram {
        groups = groups == null ? List.of() : List.copyOf(groups);
        services = services == null ? List.of() : List.copyOf(services);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    @Override
    public String diagramType() {
        return "architecture";
    }

    /**
     * Valid when edge endpoints are services, junctions or groups, and every group
     * reference of a service or group resolves.
     */
    @Override
    public boolean isValid() {
        boolean edgesResolve = edges.stream()
                .allMatch(e -> isNode(e.fromId()) && isNode(e.toId()));
        boolean servicesPlaced = services.stream()
                .allMatch(s -> s.groupId() == null || findGroup(s.groupId()) != null);
        boolean groupsNested = groups.stream()
                .allMatch(g -> g.parentId() == null || findGroup(g.parentId()) != null);
        return edgesResolve && servicesPlaced && groupsNested;
    }

    private boolean isNode(String id) {
        return findService(id) != null || findGroup(id) != null;
    }

    public ArchitectureService findService(String id) {
        return services.stream().filter(s -> s.id().equals(id)).findFirst().orElse(null);
    }

    public ArchitectureGroup findGroup(String id) {
        return groups.stream().filter(g -> g.id().equals(id)).findFirst().orElse(null);
    }

    public List<ArchitectureService> servicesIn(String groupId) {
        return services.stream().filter(s -> groupId.equals(s.groupId())).toList();
    }

    public List<ArchitectureEdge> edgesFrom(String id) {
        return edges.stream().filter(e -> e.fromId().equals(id)).toList();
    }

    public List<ArchitectureEdge> edgesTo(String id) {
        return edges.stream().filter(e -> e.toId().equals(id)).toList();
    }
}
