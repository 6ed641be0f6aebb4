package org.sirena.flowchart.models;

import java.util.List;

public record FlowchartSubgraph(
        String id,
        String title,
        String direction,   // null unless the body declares one
        List<String> nodeIds,
        String parentId     // null for top-level subgraphs
) {
    public FlowchartSubgraph {
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }
}
